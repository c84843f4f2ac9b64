package co.fanki.faex.analysis.application;

import co.fanki.faex.analysis.application.report.DeclarationSuggester;
import co.fanki.faex.analysis.application.report.DeclarationSuggester.Suggestion;
import co.fanki.faex.analysis.application.report.JsonReportFormatter;
import co.fanki.faex.analysis.domain.AnalysisResult;
import co.fanki.faex.shared.DomainException;
import co.fanki.faex.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST controller for checking endpoint exception declarations.
 *
 * <p>The analyzed path is read from the filesystem of the server.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Exception Check",
        description = "Check declared exceptions of FastAPI endpoints")
public class ExceptionCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExceptionCheckController.class);

    private final EndpointAnalysisService analysisService;
    private final JsonReportFormatter jsonReport;
    private final DeclarationSuggester suggester = new DeclarationSuggester();

    /**
     * Creates a new ExceptionCheckController.
     *
     * @param theAnalysisService the analysis service
     * @param theObjectMapper the mapper used to build JSON reports
     */
    public ExceptionCheckController(
            final EndpointAnalysisService theAnalysisService,
            final ObjectMapper theObjectMapper) {
        this.analysisService = theAnalysisService;
        this.jsonReport = new JsonReportFormatter(theObjectMapper);
    }

    /**
     * Checks every endpoint under a path.
     *
     * @param request the path and optional analysis settings
     * @return the JSON report listing every endpoint
     */
    @PostMapping("/check")
    @Operation(summary = "Check endpoint exception declarations",
            description = "Analyzes the Python files under the given path"
                    + " and reports, per endpoint, the raised exceptions"
                    + " missing from exceptions=[...].")
    public ResponseEntity<?> check(@RequestBody final CheckRequest request) {
        LOG.info("Exception check requested for: {}", request.path());

        try {
            final AnalysisResult result = analyze(request);
            return ResponseEntity.ok(jsonReport.toTree(result, true));
        } catch (final DomainException e) {
            LOG.warn("Exception check failed: {}", e.getMessage());
            return badRequest(e);
        }
    }

    /**
     * Suggests complete exception declarations.
     *
     * @param request the path and optional analysis settings
     * @return one suggestion per endpoint with undeclared exceptions
     */
    @PostMapping("/suggest")
    @Operation(summary = "Suggest exception declarations",
            description = "Returns, for every endpoint with undeclared"
                    + " exceptions, the sorted exceptions=[...] list it"
                    + " should declare.")
    public ResponseEntity<?> suggest(@RequestBody final CheckRequest request) {
        LOG.info("Declaration suggestions requested for: {}",
                request.path());

        try {
            final AnalysisResult result = analyze(request);
            final List<Map<String, Object>> body = suggester.suggest(result)
                    .stream()
                    .map(Suggestion::toMap)
                    .toList();
            return ResponseEntity.ok(body);
        } catch (final DomainException e) {
            LOG.warn("Declaration suggestion failed: {}", e.getMessage());
            return badRequest(e);
        }
    }

    private AnalysisResult analyze(final CheckRequest request) {
        final Path path = Preconditions.requirePath(request.path());
        final AnalysisOptions options = analysisService.defaultOptions()
                .override(request.maxDepth(), request.ignore());
        return analysisService.analyze(path, options);
    }

    private static ResponseEntity<?> badRequest(final DomainException e) {
        return ResponseEntity.badRequest().body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

    /**
     * Request body for the check and suggest operations.
     *
     * @param path the file or directory to analyze
     * @param maxDepth the call depth, or null for the configured default
     * @param ignore exception names to leave out, or null for the
     *        configured default
     */
    public record CheckRequest(String path, Integer maxDepth,
            List<String> ignore) {}
}
