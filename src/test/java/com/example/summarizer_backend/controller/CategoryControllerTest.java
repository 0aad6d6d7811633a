package com.example.summarizer_backend.controller;

import com.example.summarizer_backend.catalog.CategoryCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CategoryController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(CategoryCatalog.class)
class CategoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsFixedCatalog() throws Exception {
        mockMvc.perform(get("/v1/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.length()").value(6))
                .andExpect(jsonPath("$.categories[*].id").value(hasItems("action", "landscape", "key_moments")))
                .andExpect(jsonPath("$.categories[0].name").exists())
                .andExpect(jsonPath("$.categories[0].description").exists());
    }
}
