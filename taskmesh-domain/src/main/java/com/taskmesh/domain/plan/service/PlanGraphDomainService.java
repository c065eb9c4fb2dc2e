package com.taskmesh.domain.plan.service;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 计划依赖图校验：id 唯一、无自依赖、无悬空引用、无环（Kahn 拓扑排序）。
 */
@Service
public class PlanGraphDomainService {

    public void validate(Collection<PlanTaskEntity> tasks) {
        Map<String, PlanTaskEntity> tasksById = new LinkedHashMap<>();
        for (PlanTaskEntity task : tasks) {
            if (task == null || StringUtils.isBlank(task.getId())) {
                throw invalidGraph("task id cannot be empty");
            }
            if (tasksById.put(task.getId(), task) != null) {
                throw invalidGraph("duplicate task id " + task.getId());
            }
        }

        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (String id : tasksById.keySet()) {
            indegree.put(id, 0);
            adjacency.put(id, new LinkedHashSet<>());
        }

        for (PlanTaskEntity task : tasksById.values()) {
            for (String dep : task.safeDependencies()) {
                if (StringUtils.equals(dep, task.getId())) {
                    throw invalidGraph("task " + task.getId() + " depends on itself");
                }
                if (!tasksById.containsKey(dep)) {
                    throw invalidGraph("task " + task.getId() + " references missing dependency " + dep);
                }
                if (adjacency.get(dep).add(task.getId())) {
                    indegree.put(task.getId(), indegree.get(task.getId()) + 1);
                }
            }
        }

        ArrayDeque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : indegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.add(entry.getKey());
            }
        }

        int visited = 0;
        while (!queue.isEmpty()) {
            String node = queue.poll();
            visited++;
            for (String next : adjacency.getOrDefault(node, Collections.emptySet())) {
                int in = indegree.get(next) - 1;
                indegree.put(next, in);
                if (in == 0) {
                    queue.add(next);
                }
            }
        }

        if (visited != tasksById.size()) {
            throw invalidGraph("dependency cycle detected");
        }
    }

    private AppException invalidGraph(String reason) {
        return new AppException(ResponseCode.INVALID_GRAPH, "Invalid task graph: " + reason);
    }
}
