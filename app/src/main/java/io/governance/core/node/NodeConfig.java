package io.governance.core.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.governance.core.gov.GovernanceParams;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for a local governance node. Any field missing from a loaded file takes its
 * {@link #defaultLocal()} value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NodeConfig {
    public static final String FILE_NAME = "governance.json";

    public final String contractAddress;
    public final String tokenAddress;
    public final String owner;
    public final Map<String, Long> genesisAllocations;
    public final BigDecimal quorum;
    public final BigDecimal threshold;
    public final long votingPeriod;
    public final long timelockPeriod;
    public final long expirationPeriod;
    public final long proposalDeposit;
    public final long snapshotPeriod;

    public NodeConfig(String contractAddress, String tokenAddress, String owner, Map<String, Long> genesisAllocations,
                      BigDecimal quorum, BigDecimal threshold, long votingPeriod, long timelockPeriod,
                      long expirationPeriod, long proposalDeposit, long snapshotPeriod) {
        this.contractAddress = contractAddress;
        this.tokenAddress = tokenAddress;
        this.owner = owner;
        this.genesisAllocations = Map.copyOf(genesisAllocations);
        this.quorum = quorum;
        this.threshold = threshold;
        this.votingPeriod = votingPeriod;
        this.timelockPeriod = timelockPeriod;
        this.expirationPeriod = expirationPeriod;
        this.proposalDeposit = proposalDeposit;
        this.snapshotPeriod = snapshotPeriod;
    }

    @JsonCreator
    static NodeConfig fromJson(@JsonProperty("contractAddress") String contractAddress,
                               @JsonProperty("tokenAddress") String tokenAddress,
                               @JsonProperty("owner") String owner,
                               @JsonProperty("genesisAllocations") Map<String, Long> genesisAllocations,
                               @JsonProperty("quorum") BigDecimal quorum,
                               @JsonProperty("threshold") BigDecimal threshold,
                               @JsonProperty("votingPeriod") Long votingPeriod,
                               @JsonProperty("timelockPeriod") Long timelockPeriod,
                               @JsonProperty("expirationPeriod") Long expirationPeriod,
                               @JsonProperty("proposalDeposit") Long proposalDeposit,
                               @JsonProperty("snapshotPeriod") Long snapshotPeriod) {
        NodeConfig d = defaultLocal();
        return new NodeConfig(
                contractAddress != null ? contractAddress : d.contractAddress,
                tokenAddress != null ? tokenAddress : d.tokenAddress,
                owner != null ? owner : d.owner,
                genesisAllocations != null ? genesisAllocations : d.genesisAllocations,
                quorum != null ? quorum : d.quorum,
                threshold != null ? threshold : d.threshold,
                votingPeriod != null ? votingPeriod : d.votingPeriod,
                timelockPeriod != null ? timelockPeriod : d.timelockPeriod,
                expirationPeriod != null ? expirationPeriod : d.expirationPeriod,
                proposalDeposit != null ? proposalDeposit : d.proposalDeposit,
                snapshotPeriod != null ? snapshotPeriod : d.snapshotPeriod);
    }

    public static NodeConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put("alice123456", 1_000_000L);
        alloc.put("bob654321",     500_000L);
        return new NodeConfig(
                "gov-contract",
                "gov-token",
                "alice123456",
                alloc,
                new BigDecimal("0.3"),   // quorum
                new BigDecimal("0.5"),   // threshold
                100L,                    // voting period (heights)
                10L,                     // timelock
                200L,                    // expiration
                100L,                    // proposal deposit (minor units)
                20L                      // snapshot lead time
        );
    }

    /** Reads {@code path} as JSON. */
    public static NodeConfig load(Path path) throws IOException {
        try (var in = Files.newInputStream(path)) {
            return new ObjectMapper().readValue(in, NodeConfig.class);
        }
    }

    /** Loads {@value #FILE_NAME} from {@code dataDir} when present, otherwise the local defaults. */
    public static NodeConfig loadOrDefault(Path dataDir) throws IOException {
        Path file = dataDir.resolve(FILE_NAME);
        return Files.isRegularFile(file) ? load(file) : defaultLocal();
    }

    public GovernanceParams toParams() {
        return new GovernanceParams(quorum, threshold, votingPeriod, timelockPeriod, expirationPeriod,
                proposalDeposit, snapshotPeriod);
    }
}
