package com.pumpd.backend.controllers.sequence;

import com.pumpd.backend.dto.sequence.VariableDtos;
import com.pumpd.backend.dto.sequence.request.VariablePreviewRequest;
import com.pumpd.backend.dto.sequence.request.VariableValidationRequest;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.security.OrgContext;
import com.pumpd.backend.services.sequence.VariableResolutionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Message variable catalogue and previews for the template editor.
 */
@RestController
@RequestMapping("/api/variables")
@RequiredArgsConstructor
public class VariableController {

    private final VariableResolutionService variableResolutionService;
    private final RestaurantRepository restaurantRepository;

    @GetMapping
    public ResponseEntity<List<VariableDtos.VariableCategory>> listVariables() {
        return ResponseEntity.ok(variableResolutionService.availableVariables());
    }

    @PostMapping("/preview")
    public ResponseEntity<VariableDtos.PreviewResult> preview(
            @Valid @RequestBody VariablePreviewRequest request,
            OrgContext org) {
        Restaurant restaurant = restaurantRepository
                .findByIdAndOrganisationId(request.getRestaurantId(), org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant", request.getRestaurantId()));

        return ResponseEntity.ok(VariableDtos.PreviewResult.builder()
                .restaurantId(restaurant.getId())
                .original(request.getText())
                .rendered(variableResolutionService.resolve(request.getText(), restaurant))
                .variables(new ArrayList<>(variableResolutionService.extract(request.getText())))
                .build());
    }

    @PostMapping("/validate")
    public ResponseEntity<VariableDtos.ValidationResult> validate(@Valid @RequestBody VariableValidationRequest request) {
        return ResponseEntity.ok(variableResolutionService.validate(request.getText()));
    }
}
