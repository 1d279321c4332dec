package com.example.fanout.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.fanout.service.NotificationFanoutService;
import com.example.fanout.service.NotificationMaintenanceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationAdminController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationAdminControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationFanoutService fanoutService;
  @MockitoBean private NotificationMaintenanceService maintenanceService;

  @Test
  void deleteAllForUserReturnsZeroWhenNothingStored() throws Exception {
    when(fanoutService.deleteAllForUser("ghost")).thenReturn(0);

    mockMvc
        .perform(delete("/internal/users/ghost/notifications"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted_count").value(0));
  }

  @Test
  void pruneOrphansReturnsDeletedCount() throws Exception {
    when(maintenanceService.pruneOrphans()).thenReturn(1);

    mockMvc
        .perform(post("/internal/maintenance/prune-orphans"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted_count").value(1));
  }

  @Test
  void purgeExpiredReturnsDeletedCount() throws Exception {
    when(maintenanceService.purgeExpired()).thenReturn(3);

    mockMvc
        .perform(post("/internal/maintenance/purge-expired"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted_count").value(3));
  }
}
