package nl.bytesoflife.wirebom.trace;

/**
 * Trace results for both ends of one fragment.
 */
public record FragmentTrace(TraceResult start, TraceResult end) {

    public boolean isComplete() {
        return start instanceof TraceResult.Found && end instanceof TraceResult.Found;
    }
}
