package de.htwsaar.modelcache.cache.error;

/**
 * Die gespeicherte Prüfsumme passt nicht zum Payload. Der Eintrag gilt als korrupt.
 */
public class IntegrityCheckException extends ModelCacheException {

    private final String id;
    private final String expectedChecksum;
    private final String actualChecksum;

    public IntegrityCheckException(String id, String expectedChecksum, String actualChecksum) {
        super("Integrity check failed for '" + id + "': expected sha256 " + expectedChecksum
                + " but payload hashes to " + actualChecksum);
        this.id = id;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public String getId() {
        return id;
    }

    public String getExpectedChecksum() {
        return expectedChecksum;
    }

    public String getActualChecksum() {
        return actualChecksum;
    }
}
