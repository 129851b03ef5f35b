package com.pumpd.backend.controllers.sequence;

import com.pumpd.backend.dto.sequence.request.BulkStartSequenceRequest;
import com.pumpd.backend.dto.sequence.request.FinishSequenceRequest;
import com.pumpd.backend.dto.sequence.request.StartSequenceRequest;
import com.pumpd.backend.dto.sequence.response.BulkStartResultDto;
import com.pumpd.backend.dto.sequence.response.FinishResultDto;
import com.pumpd.backend.dto.sequence.response.SequenceInstanceDto;
import com.pumpd.backend.dto.sequence.response.SequenceProgressDto;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.models.sequence.InstanceWithTasks;
import com.pumpd.backend.security.OrgContext;
import com.pumpd.backend.services.sequence.BulkSequenceService;
import com.pumpd.backend.services.sequence.SequenceFinishService;
import com.pumpd.backend.services.sequence.SequenceInstanceService;
import com.pumpd.backend.services.sequence.SequenceLifecycleService;
import com.pumpd.backend.util.SequenceMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sequence-instances")
@RequiredArgsConstructor
@Slf4j
public class SequenceInstanceController {

    private final SequenceInstanceService instanceService;
    private final BulkSequenceService bulkSequenceService;
    private final SequenceLifecycleService lifecycleService;
    private final SequenceFinishService finishService;

    @PostMapping
    public ResponseEntity<SequenceInstanceDto> startSequence(
            @Valid @RequestBody StartSequenceRequest request,
            OrgContext org) {
        InstanceWithTasks started = instanceService.start(
                org, request.getSequenceTemplateId(), request.getRestaurantId(), request.getAssignedTo());
        return ResponseEntity.status(HttpStatus.CREATED).body(SequenceMapper.toDto(started));
    }

    /**
     * 201 when every restaurant started, 207 when some or all failed.
     * A malformed request or an unusable template is rejected with 400 before anything starts.
     */
    @PostMapping("/bulk")
    public ResponseEntity<BulkStartResultDto> startSequenceBulk(
            @RequestBody BulkStartSequenceRequest request,
            OrgContext org) {
        BulkStartResultDto result = bulkSequenceService.startBulk(
                org, request.getSequenceTemplateId(), request.getRestaurantIds(), request.getAssignedTo());

        HttpStatus status = result.allSucceeded() ? HttpStatus.CREATED : HttpStatus.MULTI_STATUS;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping
    public ResponseEntity<List<SequenceInstanceDto>> listInstances(
            @RequestParam(name = "status", required = false) List<InstanceStatus> statuses,
            @RequestParam(name = "restaurantId", required = false) List<Long> restaurantIds,
            @RequestParam(required = false) String assignedTo,
            @RequestParam(required = false) String search,
            OrgContext org) {
        List<SequenceInstanceDto> dtos = instanceService.listInstances(org, statuses, restaurantIds, assignedTo, search)
                .stream()
                .map(SequenceMapper::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @GetMapping("/{instanceId}")
    public ResponseEntity<SequenceInstanceDto> getInstance(@PathVariable Long instanceId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(instanceService.getInstanceWithTasks(org, instanceId)));
    }

    @GetMapping("/{instanceId}/progress")
    public ResponseEntity<SequenceProgressDto> getProgress(@PathVariable Long instanceId, OrgContext org) {
        return ResponseEntity.ok(instanceService.getProgress(org, instanceId));
    }

    @PostMapping("/{instanceId}/pause")
    public ResponseEntity<SequenceInstanceDto> pause(@PathVariable Long instanceId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(lifecycleService.pause(org, instanceId)));
    }

    @PostMapping("/{instanceId}/resume")
    public ResponseEntity<SequenceInstanceDto> resume(@PathVariable Long instanceId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(lifecycleService.resume(org, instanceId)));
    }

    @PostMapping("/{instanceId}/cancel")
    public ResponseEntity<SequenceInstanceDto> cancel(@PathVariable Long instanceId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(lifecycleService.cancel(org, instanceId)));
    }

    @PostMapping("/{instanceId}/finish")
    public ResponseEntity<FinishResultDto> finish(
            @PathVariable Long instanceId,
            @Valid @RequestBody FinishSequenceRequest request,
            OrgContext org) {
        log.info("Finishing instance {} with mode {} for user {}", instanceId, request.getMode(), org.userId());
        return ResponseEntity.ok(SequenceMapper.toDto(
                finishService.finish(org, instanceId, request.getMode(), request.getNextTemplateId())));
    }
}
