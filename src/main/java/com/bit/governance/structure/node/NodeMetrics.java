package com.bit.governance.structure.node;

import com.bit.governance.common.Address;
import com.bit.governance.proto.Structure;
import com.google.protobuf.ByteString;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 理事会节点运行指标
 */
@Data
@NoArgsConstructor
public class NodeMetrics {
    // 保留最近10次性能评分
    public static final int HISTORY_LIMIT = 10;

    private Address nodeAddress;
    //在线率 0~100
    private int uptimePercentage;
    //性能评分 0~100
    private int performanceScore;
    private long blocksProduced;
    //共识参与率 0~100
    private int consensusParticipation;
    private long lastUpdated;
    /**
     * 性能趋势：1上升 0持平 -1下降
     */
    private int trendDirection;
    /**
     * 首次上报者，拥有该记录的更新权
     */
    private Address reporter;
    private List<Integer> performanceHistory = new ArrayList<>();

    public void appendHistory(int score) {
        performanceHistory.add(score);
        while (performanceHistory.size() > HISTORY_LIMIT) {
            performanceHistory.remove(0);
        }
    }

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static NodeMetrics deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoNodeMetrics.parseFrom(data));
    }

    public Structure.ProtoNodeMetrics toProto() {
        return Structure.ProtoNodeMetrics.newBuilder()
                .setNodeAddress(ByteString.copyFrom(nodeAddress.toBytes()))
                .setUptimePercentage(uptimePercentage)
                .setPerformanceScore(performanceScore)
                .setBlocksProduced(blocksProduced)
                .setConsensusParticipation(consensusParticipation)
                .setLastUpdated(lastUpdated)
                .setTrendDirection(trendDirection)
                .setReporter(ByteString.copyFrom(reporter.toBytes()))
                .addAllPerformanceHistory(performanceHistory)
                .build();
    }

    public static NodeMetrics fromProto(Structure.ProtoNodeMetrics proto) {
        NodeMetrics metrics = new NodeMetrics();
        metrics.setNodeAddress(Address.fromBytes(proto.getNodeAddress().toByteArray()));
        metrics.setUptimePercentage(proto.getUptimePercentage());
        metrics.setPerformanceScore(proto.getPerformanceScore());
        metrics.setBlocksProduced(proto.getBlocksProduced());
        metrics.setConsensusParticipation(proto.getConsensusParticipation());
        metrics.setLastUpdated(proto.getLastUpdated());
        metrics.setTrendDirection(proto.getTrendDirection());
        metrics.setReporter(Address.fromBytes(proto.getReporter().toByteArray()));
        metrics.setPerformanceHistory(new ArrayList<>(proto.getPerformanceHistoryList()));
        return metrics;
    }
}
