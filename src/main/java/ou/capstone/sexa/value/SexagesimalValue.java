package ou.capstone.sexa.value;

/**
 * A value that formats as first segment, minutes and seconds.
 */
public interface SexagesimalValue {

    ValueKind kind();

    /**
     * The value in units of its first segment: degrees for angles, hours
     * for hour angles, right ascensions and times.
     */
    double firstSegment();
}
