package udem.fieldauthors.collection;

public record RunSummary(
        String fieldName,
        int pages,
        long scanned,
        long kept,
        String lastCursor,   // null when the sequence was exhausted
        boolean interrupted
) {
    public boolean completed() {
        return !interrupted;
    }
}
