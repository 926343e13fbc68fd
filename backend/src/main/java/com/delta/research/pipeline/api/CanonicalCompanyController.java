package com.delta.research.pipeline.api;

import com.delta.research.pipeline.model.EnrichmentAssignmentRead;
import com.delta.research.pipeline.persistence.CanonicalEntityRepository;
import com.delta.research.pipeline.service.EnrichmentAssignmentService;
import com.delta.research.pipeline.service.ResourceNotFoundException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/canonical-companies")
public class CanonicalCompanyController {
    private final CanonicalEntityRepository canonicalRepository;
    private final EnrichmentAssignmentService assignmentService;

    public CanonicalCompanyController(
        CanonicalEntityRepository canonicalRepository,
        EnrichmentAssignmentService assignmentService
    ) {
        this.canonicalRepository = canonicalRepository;
        this.assignmentService = assignmentService;
    }

    @GetMapping("/{companyId}/assignments")
    public List<EnrichmentAssignmentRead> assignments(
        @RequestHeader(ResearchRunController.TENANT_HEADER) String tenantId,
        @PathVariable UUID companyId
    ) {
        if (canonicalRepository.findCompany(tenantId, companyId) == null) {
            throw new ResourceNotFoundException("Canonical company " + companyId + " not found");
        }
        return assignmentService.listForCanonicalCompany(tenantId, companyId);
    }
}
