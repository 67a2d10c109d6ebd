package ai.svcs.semantic;

/**
 * Thrown by a layer that stops part way because the run's {@link CancellationSignal} fired. The engine turns it into
 * a partial result holding the events of the layers that finished.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException(String message) {
        super(message);
    }
}
