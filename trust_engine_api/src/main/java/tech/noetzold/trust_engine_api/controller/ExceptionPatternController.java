package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.ExceptionPattern;
import tech.noetzold.trust_engine_api.model.ExceptionPatternRequest;
import tech.noetzold.trust_engine_api.model.PatternFeedbackRequest;
import tech.noetzold.trust_engine_api.service.PatternExceptionClassifier;

import java.util.List;

@RestController
@RequestMapping("/organizations/{orgId}/exception-patterns")
@Tag(name = "Routing")
public class ExceptionPatternController {

    private final PatternExceptionClassifier classifier;

    public ExceptionPatternController(PatternExceptionClassifier classifier) {
        this.classifier = classifier;
    }

    @GetMapping
    public List<ExceptionPattern> list(@PathVariable String orgId) {
        return classifier.patterns(orgId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ExceptionPattern register(@PathVariable String orgId, @Valid @RequestBody ExceptionPatternRequest req) {
        return classifier.register(orgId, req);
    }

    @GetMapping("/{patternId}")
    public ExceptionPattern get(@PathVariable String orgId, @PathVariable String patternId) {
        return classifier.pattern(orgId, patternId);
    }

    @PostMapping("/{patternId}/feedback")
    public ExceptionPattern feedback(@PathVariable String orgId,
                                     @PathVariable String patternId,
                                     @Valid @RequestBody PatternFeedbackRequest req) {
        return classifier.recordFeedback(orgId, patternId, req.override_correct());
    }
}
