package com.finpal.assistant.controller;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the HTML pages. The pages themselves are static files under /static/pages.
 */
@Controller
public class PageController {

    static final String PAGES = "forward:/static/pages/";

    @GetMapping("/")
    public String login() {
        return PAGES + "login.html";
    }

    @GetMapping("/register")
    public String register() {
        return PAGES + "register.html";
    }

    @GetMapping("/chat_page")
    public String chat() {
        return PAGES + "chat.html";
    }

    @GetMapping("/insights")
    public String insights() {
        return PAGES + "insights.html";
    }

    @GetMapping("/portfolio")
    public String portfolio() {
        return PAGES + "portfolio.html";
    }
}
