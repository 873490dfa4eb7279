package com.example.dbconsole.controller;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the console page from {@code static/index.html}.
 */
@Controller
public class ConsoleController {

    @GetMapping("/")
    public String index() {
        return "forward:/index.html";
    }
}
