package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.command.ClubCommand;
import com.polishfootball.network.application.command.ClubCommandService;
import com.polishfootball.network.application.dto.ClubSummary;
import com.polishfootball.network.infrastructure.web.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Club management. Validation and not-found outcomes are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/admin/clubs")
public class ClubAdminController {

    private final ClubCommandService clubCommandService;

    public ClubAdminController(ClubCommandService clubCommandService) {
        this.clubCommandService = clubCommandService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ClubSummary>> createClub(@RequestBody ClubCommand command) {
        ClubSummary created = clubCommandService.create(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Club created", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ClubSummary>> updateClub(@PathVariable UUID id, @RequestBody ClubCommand command) {
        return ResponseEntity.ok(ApiResponse.ok("Club updated", clubCommandService.update(id, command)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteClub(@PathVariable UUID id) {
        clubCommandService.delete(id);
        return ResponseEntity.ok(ApiResponse.ok("Club deleted", null));
    }
}
