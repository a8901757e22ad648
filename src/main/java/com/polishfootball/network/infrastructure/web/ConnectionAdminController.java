package com.polishfootball.network.infrastructure.web;

import com.polishfootball.network.application.command.ConnectionCommand;
import com.polishfootball.network.application.command.ConnectionCommandService;
import com.polishfootball.network.domain.model.Connection;
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

@RestController
@RequestMapping("/api/admin/connections")
public class ConnectionAdminController {

    private final ConnectionCommandService connectionCommandService;

    public ConnectionAdminController(ConnectionCommandService connectionCommandService) {
        this.connectionCommandService = connectionCommandService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Connection>> createConnection(@RequestBody ConnectionCommand command) {
        Connection created = connectionCommandService.create(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Connection created", created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Connection>> updateConnection(@PathVariable UUID id,
                                                                    @RequestBody ConnectionCommand command) {
        return ResponseEntity.ok(ApiResponse.ok("Connection updated", connectionCommandService.update(id, command)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteConnection(@PathVariable UUID id) {
        connectionCommandService.delete(id);
        return ResponseEntity.ok(ApiResponse.ok("Connection deleted", null));
    }
}
