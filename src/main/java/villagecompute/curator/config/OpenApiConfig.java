package villagecompute.curator.config;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 metadata for the Feed Curator management API.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Feed Curator API",
                version = "1.0.0",
                description = """
                        Management API for the feed curator scheduler.

                        ## Features
                        - **Jobs**: create, inspect, update and delete scheduled recap and custom jobs
                        - **Executions**: per-run history with status, result and duration
                        - **Manual runs**: execute a job immediately outside its schedule
                        - **Config sync**: mirror recap schedules from the feed configuration file

                        All schedules are five-field cron expressions evaluated in UTC, or a single ISO-8601
                        timestamp for one-time jobs.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Jobs",
                description = "Scheduled job management and execution history"),
                @Tag(
                        name = "Scheduler",
                        description = "Leader election state of the serving node")})
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
