package co.fanki.faex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * faex server application.
 *
 * <p>Serves the exception check over REST and, when
 * {@code mcp.server.stdio=true}, as MCP tools over stdin/stdout. The
 * command line entry point is {@link co.fanki.faex.cli.FaexCommandLine}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FaexApplication {

    /**
     * Main entry point for the server.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(FaexApplication.class, args);
    }

}
