package co.fanki.faex.config;

import co.fanki.faex.analysis.application.AnalysisOptions;
import co.fanki.faex.analysis.application.EndpointAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Liveness endpoint reporting the analysis defaults in effect.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final EndpointAnalysisService analysisService;

    /**
     * Creates a new HealthController.
     *
     * @param theAnalysisService the service whose defaults are reported
     */
    public HealthController(final EndpointAnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    /**
     * Returns health status.
     *
     * @return status "up" with the default depth and ignored names
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        final AnalysisOptions defaults = analysisService.defaultOptions();
        return ResponseEntity.ok(Map.of(
                "status", "up",
                "maxDepth", defaults.maxDepth(),
                "ignore", List.copyOf(defaults.ignore())));
    }

}
