package com.pumpd.backend.controllers.sequence;

import com.pumpd.backend.dto.sequence.response.TaskProgressionResultDto;
import com.pumpd.backend.security.OrgContext;
import com.pumpd.backend.services.sequence.SequenceProgressionService;
import com.pumpd.backend.util.SequenceMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final SequenceProgressionService progressionService;

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<TaskProgressionResultDto> complete(@PathVariable Long taskId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(progressionService.completeTask(org, taskId)));
    }

    @PostMapping("/{taskId}/skip")
    public ResponseEntity<TaskProgressionResultDto> skip(@PathVariable Long taskId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(progressionService.skipTask(org, taskId)));
    }
}
