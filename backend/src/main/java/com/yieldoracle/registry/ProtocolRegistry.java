package com.yieldoracle.registry;

import com.yieldoracle.cache.CacheKeys;
import com.yieldoracle.config.AppProps;
import com.yieldoracle.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of yield sources. Loaded from {@code app.protocols} at startup and never mutated.
 */
@Component
@Slf4j
public class ProtocolRegistry {

    private final Map<String, ProtocolSource> byId;

    @Autowired
    public ProtocolRegistry(AppProps props) {
        this(fromConfig(props));
    }

    public ProtocolRegistry(List<ProtocolSource> sources) {
        Map<String, ProtocolSource> m = new LinkedHashMap<>();
        for (ProtocolSource s : sources) {
            if (CacheKeys.LATEST.equals(CacheKeys.protocol(s.getId()))) {
                throw new IllegalArgumentException("Protocol id '" + s.getId() + "' is reserved for the snapshot key");
            }
            if (m.putIfAbsent(s.getId(), s) != null) {
                throw new IllegalArgumentException("Duplicate protocol id: " + s.getId());
            }
        }
        this.byId = Collections.unmodifiableMap(m);
        log.info("[registry] {} protocol(s) registered: {}", byId.size(), byId.keySet());
    }

    public List<ProtocolSource> all() {
        return List.copyOf(byId.values());
    }

    Optional<ProtocolSource> find(String protocolId) {
        return Optional.ofNullable(protocolId).map(byId::get);
    }

    public boolean contains(String protocolId) {
        return protocolId != null && byId.containsKey(protocolId);
    }

    int size() {
        return byId.size();
    }

    // ----------------- config mapping -----------------

    private static List<ProtocolSource> fromConfig(AppProps props) {
        if (props.getProtocols() == null || props.getProtocols().isEmpty()) {
            log.warn("[registry] no protocols configured under app.protocols");
            return List.of();
        }
        List<ProtocolSource> out = new ArrayList<>(props.getProtocols().size());
        props.getProtocols().forEach((id, p) -> out.add(toSource(id, p)));
        return out;
    }

    static ProtocolSource toSource(String id, AppProps.Protocol p) {
        EncodingKind encoding = EncodingKind.parse(p.getEncoding());
        if (encoding == EncodingKind.DEFAULT) {
            log.warn("[registry] protocol={} has unrecognized encoding '{}', using basis points", id, p.getEncoding());
        }
        BigInteger minLiquidity = p.getMinLiquidity() == null ? BigInteger.ZERO : p.getMinLiquidity();
        if (minLiquidity.signum() < 0) {
            throw new IllegalArgumentException("minLiquidity must be >= 0 for protocol " + id);
        }
        return ProtocolSource.builder()
                .id(id)
                .name(p.getName() == null ? id : p.getName())
                .address(AddressUtil.normalize(p.getAddress()))
                .apyCall(toCall(id, "apy", p.getApy()))
                .tvlCall(toCall(id, "tvl", p.getTvl()))
                .liquidityCall(toCall(id, "liquidity", p.getLiquidity()))
                .encoding(encoding)
                .riskScore(p.getRiskScore())
                .minLiquidity(minLiquidity)
                .tokenDecimals(p.getTokenDecimals())
                .blockTimeSeconds(p.getBlockTimeSeconds())
                .build();
    }

    private static ContractCall toCall(String id, String op, AppProps.Call c) {
        if (c == null || c.getFunction() == null || c.getFunction().isBlank()) {
            throw new IllegalArgumentException("Missing " + op + " call for protocol " + id);
        }
        if (c.getOutputIndex() < 0 || c.getOutputIndex() >= c.getOutputs()) {
            throw new IllegalArgumentException("outputIndex out of range for " + op + " call of protocol " + id);
        }
        List<String> args = c.getArgs() == null ? List.of() : c.getArgs().stream().map(AddressUtil::normalize).toList();
        return ContractCall.builder()
                .function(c.getFunction())
                .args(args)
                .outputs(c.getOutputs())
                .outputIndex(c.getOutputIndex())
                .build();
    }
}
