package com.pumpd.backend.controllers.sequence;

import com.pumpd.backend.dto.sequence.request.CreateSequenceTemplateRequest;
import com.pumpd.backend.dto.sequence.request.UpdateTemplateStatusRequest;
import com.pumpd.backend.dto.sequence.response.SequenceTemplateDto;
import com.pumpd.backend.security.OrgContext;
import com.pumpd.backend.services.sequence.SequenceTemplateService;
import com.pumpd.backend.util.SequenceMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sequence-templates")
@RequiredArgsConstructor
public class SequenceTemplateController {

    private final SequenceTemplateService templateService;

    @GetMapping
    public ResponseEntity<List<SequenceTemplateDto>> listTemplates(
            @RequestParam(defaultValue = "false") boolean activeOnly,
            @RequestParam(required = false) String search,
            OrgContext org) {
        List<SequenceTemplateDto> dtos = templateService.listTemplates(org, activeOnly, search).stream()
                .map(SequenceMapper::toDto)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @GetMapping("/{templateId}")
    public ResponseEntity<SequenceTemplateDto> getTemplate(@PathVariable Long templateId, OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(templateService.getTemplate(org, templateId)));
    }

    @PostMapping
    public ResponseEntity<SequenceTemplateDto> createTemplate(
            @Valid @RequestBody CreateSequenceTemplateRequest request,
            OrgContext org) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SequenceMapper.toDto(templateService.createTemplate(org, request)));
    }

    @PutMapping("/{templateId}/status")
    public ResponseEntity<SequenceTemplateDto> updateStatus(
            @PathVariable Long templateId,
            @Valid @RequestBody UpdateTemplateStatusRequest request,
            OrgContext org) {
        return ResponseEntity.ok(SequenceMapper.toDto(
                templateService.setActive(org, templateId, request.getIsActive())));
    }
}
