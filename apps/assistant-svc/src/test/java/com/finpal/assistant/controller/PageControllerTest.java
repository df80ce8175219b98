package com.finpal.assistant.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.forwardedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.finpal.assistant.WebIntegrationTestSupport;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

class PageControllerTest extends WebIntegrationTestSupport {

    @Test
    void pagesForwardToStaticHtml() throws Exception {
        mockMvc.perform(get("/")).andExpect(status().isOk()).andExpect(forwardedUrl("/static/pages/login.html"));
        mockMvc.perform(get("/register")).andExpect(forwardedUrl("/static/pages/register.html"));
        mockMvc.perform(get("/chat_page")).andExpect(forwardedUrl("/static/pages/chat.html"));
        mockMvc.perform(get("/insights")).andExpect(forwardedUrl("/static/pages/insights.html"));
        mockMvc.perform(get("/portfolio")).andExpect(forwardedUrl("/static/pages/portfolio.html"));
    }

    @Test
    void staticAssetsAreServed() throws Exception {
        mockMvc.perform(get("/static/pages/chat.html"))
                .andExpect(status().isOk())
                .andExpect(content().string(Matchers.containsString("/query")));
        mockMvc.perform(get("/static/js/app.js")).andExpect(status().isOk());
    }

    @Test
    void missingAssetIsNotFound() throws Exception {
        mockMvc.perform(get("/static/nope.css")).andExpect(status().isNotFound());
    }
}
