package com.prestige.store.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.prestige.store.data.StorageException;
import com.prestige.store.service.WatchService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminWatchController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class AdminWatchControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private WatchService watchService;

  @Test
  void statsStorageFailureReturnsStorageError() throws Exception {
    when(watchService.stats())
        .thenThrow(
            new StorageException(
                "watches", "brand_breakdown", "relation \"watches\" does not exist", null));

    mockMvc
        .perform(get("/api/admin/stats"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STORAGE_ERROR"))
        .andExpect(jsonPath("$.message").value("storage operation failed"));
  }
}
