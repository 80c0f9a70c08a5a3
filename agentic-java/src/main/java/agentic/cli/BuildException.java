package agentic.cli;

/** Driver failure outside compilation proper: unset environment variables and file I/O. */
public class BuildException extends RuntimeException {
    public BuildException(String message) {
        super(message);
    }

    public BuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
