package com.crosslend.vault.web;

import com.crosslend.vault.events.LendingEventJournal;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@Validated
@RequiredArgsConstructor
public class EventController {

    private final @NonNull LendingEventJournal journal;

    @GetMapping
    public ResponseEntity<List<JsonNode>> recent(
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(name = "type", required = false) String type) {
        return ResponseEntity.ok(journal.recent(limit, type));
    }
}
