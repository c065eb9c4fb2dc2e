package com.taskmesh.domain.worker.service;

import com.taskmesh.domain.worker.adapter.gateway.ITaskWorker;
import com.taskmesh.domain.worker.model.valobj.WorkerDescriptorVO;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Worker 注册表：agentType → worker。容器中所有 {@link ITaskWorker} 在启动时注册。
 */
@Slf4j
@Service
public class WorkerRegistry {

    private final Map<String, ITaskWorker> workers = new ConcurrentSkipListMap<>();

    public WorkerRegistry() {
    }

    @Autowired
    public WorkerRegistry(ObjectProvider<ITaskWorker> workerProvider) {
        workerProvider.orderedStream().forEach(worker -> register(worker.agentType(), worker));
    }

    public void register(String agentType, ITaskWorker worker) {
        if (StringUtils.isBlank(agentType) || worker == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Agent type and worker are required");
        }
        String key = agentType.trim();
        if (workers.putIfAbsent(key, worker) != null) {
            throw new AppException(ResponseCode.DUPLICATE_AGENT_TYPE, "Agent type already registered: " + key);
        }
        log.info("Worker registered. agentType={}, worker={}", key, worker.getClass().getSimpleName());
    }

    public Optional<ITaskWorker> find(String agentType) {
        if (StringUtils.isBlank(agentType)) {
            return Optional.empty();
        }
        return Optional.ofNullable(workers.get(agentType.trim()));
    }

    public List<WorkerDescriptorVO> describe() {
        return workers.entrySet().stream()
                .map(entry -> new WorkerDescriptorVO(entry.getKey(), entry.getValue().description()))
                .collect(Collectors.toList());
    }
}
