package com.expenseflow.backend.modules.directory.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.expenseflow.backend.modules.directory.application.DirectorySyncService;
import com.expenseflow.backend.modules.directory.application.DirectorySyncService.SyncApplyCommand;
import com.expenseflow.backend.modules.directory.presentation.dto.DirectorySyncApplyRequest;
import com.expenseflow.backend.modules.directory.presentation.dto.DirectorySyncApplyResponse;
import com.expenseflow.backend.modules.directory.presentation.dto.DirectorySyncPreviewResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/employees/sync-from-external")
@Tag(name = "Directory Sync", description = "Reconcile the local roster with the HR roster")
public class DirectorySyncController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final DirectorySyncService directorySyncService;
    private final Clock clock;

    public DirectorySyncController(DirectorySyncService directorySyncService, Clock clock) {
        this.directorySyncService = directorySyncService;
        this.clock = clock;
    }

    @PostMapping("/preview")
    @Operation(summary = "Compute creates, updates, archives and duplicates without writing")
    public ResponseEntity<DirectorySyncPreviewResponse> preview() {
        return ResponseEntity.ok(DirectorySyncPreviewResponse.from(
                directorySyncService.previewSync(),
                OffsetDateTime.now(clock)
        ));
    }

    @PostMapping("/apply")
    @Operation(summary = "Apply the approved items that are still part of a freshly computed plan")
    public ResponseEntity<DirectorySyncApplyResponse> apply(
            @RequestBody DirectorySyncApplyRequest request,
            @RequestHeader(name = ACTOR_HEADER, required = false) String actorId
    ) {
        SyncApplyCommand command = new SyncApplyCommand(
                request.toCreateOrEmpty(),
                request.toUpdateOrEmpty(),
                request.toArchiveOrEmpty(),
                request.toRemoveDuplicatesOrEmpty(),
                actorId
        );
        return ResponseEntity.ok(DirectorySyncApplyResponse.from(
                directorySyncService.applySync(command),
                OffsetDateTime.now(clock)
        ));
    }
}
