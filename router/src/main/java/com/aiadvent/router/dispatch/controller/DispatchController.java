package com.aiadvent.router.dispatch.controller;

import com.aiadvent.router.dispatch.api.CandidatesResponse;
import com.aiadvent.router.dispatch.api.GenerateRequest;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import com.aiadvent.router.dispatch.provider.CompletionResponse;
import com.aiadvent.router.dispatch.routing.RegisteredCandidate;
import com.aiadvent.router.dispatch.service.DispatchService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DispatchController {

  private final DispatchService dispatchService;

  public DispatchController(DispatchService dispatchService) {
    this.dispatchService = dispatchService;
  }

  @PostMapping("/generate")
  public CompletionResponse generate(@Valid @RequestBody GenerateRequest request) {
    return dispatchService.processRequest(request.prompt(), request.options());
  }

  @GetMapping("/candidates")
  public CandidatesResponse candidates() {
    List<CandidatesResponse.Candidate> candidates =
        dispatchService.registry().candidates().stream().map(this::toCandidate).toList();
    return new CandidatesResponse(candidates);
  }

  private CandidatesResponse.Candidate toCandidate(RegisteredCandidate candidate) {
    CapabilityProfile profile = candidate.profile();
    return new CandidatesResponse.Candidate(
        profile.key(),
        profile.providerName(),
        profile.modelName(),
        profile.capabilities(),
        profile.costPerInputUnit(),
        profile.costPerOutputUnit());
  }
}
