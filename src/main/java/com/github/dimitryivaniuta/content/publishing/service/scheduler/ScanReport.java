package com.github.dimitryivaniuta.content.publishing.service.scheduler;

/**
 * Outcome counts of one scheduler scan.
 *
 * @param due due posts found
 * @param claimed claims won by this instance
 * @param claimLost claims lost to another instance or to a change made after the due query
 * @param published posts moved to PUBLISHED
 * @param failed posts moved to FAILED
 * @param errors posts whose resolution threw
 * @param aborted true when the due query itself failed
 */
public record ScanReport(int due, int claimed, int claimLost, int published, int failed, int errors, boolean aborted) {

    static ScanReport skipped() {
        return new ScanReport(0, 0, 0, 0, 0, 0, false);
    }

    static ScanReport abortedScan() {
        return new ScanReport(0, 0, 0, 0, 0, 0, true);
    }
}
