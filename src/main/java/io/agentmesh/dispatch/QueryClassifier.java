package io.agentmesh.dispatch;

import java.util.Map;

public interface QueryClassifier {
    Classification classify(String query, Map<String, Object> context);
}
