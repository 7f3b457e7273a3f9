package dev.blueprint.exception;

/**
 * Fatal to the run: raised before any phase starts when a valid unit input cannot be built
 * (bad repository path, malformed request, empty or incomplete registry).
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
