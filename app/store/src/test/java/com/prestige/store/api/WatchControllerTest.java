package com.prestige.store.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.prestige.store.data.Row;
import com.prestige.store.data.StorageException;
import com.prestige.store.service.ResourceNotFoundException;
import com.prestige.store.service.WatchSearchCriteria;
import com.prestige.store.service.WatchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WatchController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class WatchControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private WatchService watchService;

  @Test
  void listReturnsRowsWithCount() throws Exception {
    when(watchService.listAvailable())
        .thenReturn(
            List.of(
                new Row().put("id", 2L).put("brand", "Omega").put("price", 4200L),
                new Row().put("id", 1L).put("brand", "Rolex").put("price", 12500L)));

    mockMvc
        .perform(get("/api/watches"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(2))
        .andExpect(jsonPath("$.data[0].brand").value("Omega"))
        .andExpect(jsonPath("$.data[1].price").value(12500));
  }

  @Test
  void unknownWatchReturns404() throws Exception {
    when(watchService.getAvailable(9L)).thenThrow(new ResourceNotFoundException("watch not found"));

    mockMvc
        .perform(get("/api/watches/9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("watch not found"));
  }

  @Test
  void searchPassesCriteria() throws Exception {
    when(watchService.search(new WatchSearchCriteria("sub", "Rolex", 1000L, 20000L, null)))
        .thenReturn(List.of(new Row().put("id", 1L).put("model", "Submariner Date")));

    mockMvc
        .perform(
            get("/api/watches/search")
                .param("q", "sub")
                .param("brand", "Rolex")
                .param("minPrice", "1000")
                .param("maxPrice", "20000"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[0].model").value("Submariner Date"));
  }

  @Test
  void invertedPriceRangeReturns400() throws Exception {
    mockMvc
        .perform(get("/api/watches/search").param("minPrice", "5000").param("maxPrice", "100"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("minPrice must not exceed maxPrice"));
    verifyNoInteractions(watchService);
  }

  @Test
  void nonNumericPriceReturns400() throws Exception {
    mockMvc
        .perform(get("/api/watches/search").param("minPrice", "cheap"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("minPrice is invalid"));
  }

  @Test
  void storageFailureHidesDetails() throws Exception {
    when(watchService.listByBrand(any()))
        .thenThrow(
            new StorageException("watches", "select", "relation \"watches\" does not exist", null));

    mockMvc
        .perform(get("/api/watches/brand/Rolex"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STORAGE_ERROR"))
        .andExpect(jsonPath("$.message").value("storage operation failed"));
  }
}
