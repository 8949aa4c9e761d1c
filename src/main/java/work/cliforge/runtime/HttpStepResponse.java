package work.cliforge.runtime;

public record HttpStepResponse(int status, String body) {
    public boolean successful() {
        return status >= 200 && status < 300;
    }
}
