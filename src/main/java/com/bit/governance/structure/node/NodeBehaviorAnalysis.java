package com.bit.governance.structure.node;

import com.bit.governance.common.Address;
import com.bit.governance.proto.Structure;
import com.google.protobuf.ByteString;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * 节点行为分析结果，每次分析全量重算后覆盖
 */
@Data
@NoArgsConstructor
public class NodeBehaviorAnalysis {
    private Address nodeAddress;
    private int analysisPeriod;
    private int reliabilityScore;
    private int consistencyScore;
    private int participationScore;
    private int overallScore;
    private RiskLevel riskLevel;
    //100 - overallScore
    private int riskScore;
    //Excellent / Good / Fair / Poor
    private String recommendation;
    private long analysisTime;
    private Address analyst;

    public byte[] serialize() {
        return toProto().toByteArray();
    }

    public static NodeBehaviorAnalysis deserialize(byte[] data) throws IOException {
        return fromProto(Structure.ProtoNodeBehaviorAnalysis.parseFrom(data));
    }

    public Structure.ProtoNodeBehaviorAnalysis toProto() {
        return Structure.ProtoNodeBehaviorAnalysis.newBuilder()
                .setNodeAddress(ByteString.copyFrom(nodeAddress.toBytes()))
                .setAnalysisPeriod(analysisPeriod)
                .setReliabilityScore(reliabilityScore)
                .setConsistencyScore(consistencyScore)
                .setParticipationScore(participationScore)
                .setOverallScore(overallScore)
                .setRiskLevel(riskLevel.getCode())
                .setRiskScore(riskScore)
                .setRecommendation(recommendation)
                .setAnalysisTime(analysisTime)
                .setAnalyst(ByteString.copyFrom(analyst.toBytes()))
                .build();
    }

    public static NodeBehaviorAnalysis fromProto(Structure.ProtoNodeBehaviorAnalysis proto) {
        NodeBehaviorAnalysis analysis = new NodeBehaviorAnalysis();
        analysis.setNodeAddress(Address.fromBytes(proto.getNodeAddress().toByteArray()));
        analysis.setAnalysisPeriod(proto.getAnalysisPeriod());
        analysis.setReliabilityScore(proto.getReliabilityScore());
        analysis.setConsistencyScore(proto.getConsistencyScore());
        analysis.setParticipationScore(proto.getParticipationScore());
        analysis.setOverallScore(proto.getOverallScore());
        analysis.setRiskLevel(RiskLevel.fromCode(proto.getRiskLevel()));
        analysis.setRiskScore(proto.getRiskScore());
        analysis.setRecommendation(proto.getRecommendation());
        analysis.setAnalysisTime(proto.getAnalysisTime());
        analysis.setAnalyst(Address.fromBytes(proto.getAnalyst().toByteArray()));
        return analysis;
    }
}
