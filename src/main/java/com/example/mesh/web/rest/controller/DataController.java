package com.example.mesh.web.rest.controller;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.web.rest.dto.DataItem;
import com.example.mesh.web.rest.dto.DataResponse;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.RestController;

/**
 * Data resource. Only reached with a live session; the security chain answers
 * everything else.
 */
@Slf4j
@RestController
@Profile({ServiceRole.DATA, ServiceRole.ALL_BACKENDS})
public class DataController implements DataAPI {

  static final String MESSAGE = "Here is your mock data!";

  static final List<DataItem> ITEMS = List.of(
      new DataItem(1, "Item 1", "This is the first mock item"),
      new DataItem(2, "Item 2", "This is the second mock item"),
      new DataItem(3, "Item 3", "This is the third mock item"));

  @Override
  public ResponseEntity<DataResponse> getData(@AuthenticationPrincipal SessionPrincipal principal) {
    log.debug("Serving data for subject {}", principal.subjectId());
    return ResponseEntity.ok(new DataResponse(MESSAGE, principal.identity(), ITEMS));
  }
}
