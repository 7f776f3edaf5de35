package com.bit.governance.support;

import com.bit.governance.auth.impl.AdminWitnessVerifier;
import com.bit.governance.common.Address;
import com.bit.governance.config.SystemConfig;
import com.bit.governance.database.memory.MemoryDb;
import com.bit.governance.event.EventType;
import com.bit.governance.event.GovernanceEvent;
import com.bit.governance.event.impl.EventLog;
import com.bit.governance.node.impl.NodeBehaviorAnalyzerImpl;
import com.bit.governance.proposal.impl.ProposalServiceImpl;
import com.bit.governance.store.GovernanceStore;
import com.bit.governance.store.KeyLocks;
import com.bit.governance.strategy.impl.StrategyServiceImpl;
import com.bit.governance.strategy.selector.DiversificationSelector;
import com.bit.governance.strategy.selector.MlDrivenSelector;
import com.bit.governance.strategy.selector.PerformanceBasedSelector;
import com.bit.governance.strategy.selector.RiskAdjustedSelector;
import com.bit.governance.voter.impl.VoterRegistryImpl;
import com.bit.governance.voting.impl.VotingConfigServiceImpl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 在内存数据库上手工装配全部服务
 */
public class GovernanceFixture {

    public static final Address ADMIN = address(1);

    public final ManualTimeSource time = new ManualTimeSource(0);
    public final MemoryDb dataBase;
    public final SystemConfig systemConfig = new SystemConfig();
    public final EventLog events;
    public final GovernanceStore store;
    public final KeyLocks keyLocks = new KeyLocks();
    public final AdminWitnessVerifier witness;
    public final RecordingExecutor executor = new RecordingExecutor();

    public final VotingConfigServiceImpl configService;
    public final VoterRegistryImpl voterRegistry;
    public final ProposalServiceImpl proposalService;
    public final NodeBehaviorAnalyzerImpl nodeAnalyzer;
    public final StrategyServiceImpl strategyService;

    public GovernanceFixture() {
        this(new MemoryDb());
    }

    public GovernanceFixture(MemoryDb dataBase) {
        this.dataBase = dataBase;
        systemConfig.setAdmins(Collections.singletonList(ADMIN.toHex()));
        events = new EventLog(systemConfig);
        store = new GovernanceStore(dataBase, events);
        witness = new AdminWitnessVerifier(systemConfig);
        configService = new VotingConfigServiceImpl(store, witness, time, keyLocks);
        voterRegistry = new VoterRegistryImpl(store, witness, time, keyLocks);
        proposalService = new ProposalServiceImpl(store, configService, witness, executor, time, keyLocks);
        nodeAnalyzer = new NodeBehaviorAnalyzerImpl(store, witness, time, keyLocks);
        strategyService = new StrategyServiceImpl(store, witness, time, keyLocks, systemConfig,
                List.of(new PerformanceBasedSelector(), new RiskAdjustedSelector(),
                        new DiversificationSelector(), new MlDrivenSelector()));
    }

    public static Address address(int n) {
        byte[] bytes = new byte[Address.LENGTH];
        bytes[0] = (byte) 0xAB;
        bytes[30] = (byte) (n >>> 8);
        bytes[31] = (byte) n;
        return Address.fromBytes(bytes);
    }

    public List<EventType> eventTypes() {
        List<EventType> types = new ArrayList<>();
        for (GovernanceEvent event : events.recent(Integer.MAX_VALUE)) {
            types.add(event.getType());
        }
        return types;
    }

    public long count(EventType type) {
        return eventTypes().stream().filter(t -> t == type).count();
    }
}
