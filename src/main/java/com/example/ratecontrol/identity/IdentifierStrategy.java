package com.example.ratecontrol.identity;

/**
 * How a client is named for counting purposes. Each strategy is bound to its extractor once,
 * so choosing a strategy in a config is also choosing the extraction code path.
 */
public enum IdentifierStrategy {

    NETWORK_ADDRESS(Extractors.NETWORK_ADDRESS),
    SUBJECT_ID(new SubjectIdExtractor(Extractors.NETWORK_ADDRESS)),
    API_KEY(new ApiKeyExtractor(Extractors.NETWORK_ADDRESS)),
    COMPOSITE(new CompositeExtractor(Extractors.NETWORK_ADDRESS));

    private final IdentifierExtractor extractor;

    IdentifierStrategy(IdentifierExtractor extractor) {
        this.extractor = extractor;
    }

    public String extract(ClientRequest request) {
        return extractor.extract(request);
    }

    /**
     * The address used for whitelist matching, whatever the strategy.
     */
    public static String networkAddress(ClientRequest request) {
        return Extractors.NETWORK_ADDRESS.extract(request);
    }

    // Enum constants cannot reference a static field of their own class during initialization.
    private static final class Extractors {
        static final IdentifierExtractor NETWORK_ADDRESS = new NetworkAddressExtractor();
    }
}
