package com.taskmesh.domain.plan.model.entity;

import com.taskmesh.domain.plan.model.valobj.TaskErrorVO;
import com.taskmesh.types.enums.ReferenceTypeEnum;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskCategoryEnum;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 计划内任务实体，依赖以任务 id 引用。
 *
 * @author taskmesh
 * @since 2026-09-02
 */
@Data
public class PlanTaskEntity {

    /**
     * 任务 ID，计划内唯一
     */
    private String id;

    /**
     * 执行该任务的 worker 类型
     */
    private String agentType;

    /**
     * 任务描述
     */
    private String description;

    /**
     * 前置依赖任务 IDs（有序）
     */
    private List<String> dependencies = new ArrayList<>();

    /**
     * 任务类别
     */
    private TaskCategoryEnum category;

    /**
     * 参照来源（仅信息参照任务）
     */
    private ReferenceTypeEnum referenceType;

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 完成结果
     */
    private String result;

    /**
     * 失败信息
     */
    private TaskErrorVO error;

    /**
     * 展示用标签
     */
    private List<String> tags = new ArrayList<>();

    /**
     * 自上次人工重试以来的派发次数
     */
    private int attemptCount;

    /**
     * 废弃标记：不派发，依赖它的任务会被阻塞
     */
    private boolean obsolete;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Task id cannot be empty");
        }
        if (StringUtils.isBlank(agentType)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Agent type cannot be empty: " + id);
        }
        if (status == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Status cannot be null: " + id);
        }
    }

    /**
     * 标记为就绪
     */
    public void markReady() {
        transitTo(TaskStatusEnum.READY);
    }

    /**
     * 标记为阻塞
     */
    public void markBlocked() {
        transitTo(TaskStatusEnum.BLOCKED);
    }

    /**
     * 开始执行，派发次数加一
     */
    public void start() {
        transitTo(TaskStatusEnum.RUNNING);
        this.attemptCount++;
    }

    /**
     * 完成任务
     */
    public void complete(String result) {
        transitTo(TaskStatusEnum.COMPLETED);
        this.result = result;
        this.error = null;
    }

    /**
     * 失败任务
     */
    public void fail(TaskErrorVO error) {
        transitTo(TaskStatusEnum.FAILED);
        this.error = error == null ? TaskErrorVO.workerError("Task failed") : error;
    }

    /**
     * 失败任务回到待处理；人工重试会清零派发次数，策略重试保留以消耗重试预算。
     */
    public void resetForRetry(boolean manual) {
        transitTo(TaskStatusEnum.PENDING);
        this.error = null;
        this.result = null;
        if (manual) {
            this.attemptCount = 0;
        }
    }

    /**
     * 阻塞任务回到待处理，由下一轮依赖解析重新判定。
     */
    public void unblock() {
        if (this.status != TaskStatusEnum.BLOCKED) {
            throw invalidTransition(TaskStatusEnum.PENDING);
        }
        transitTo(TaskStatusEnum.PENDING);
    }

    /**
     * @return 标记是否变化
     */
    public boolean markObsolete(boolean obsolete) {
        if (this.status == TaskStatusEnum.RUNNING) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "Running task cannot change obsolete flag: " + id);
        }
        if (this.obsolete == obsolete) {
            return false;
        }
        this.obsolete = obsolete;
        touch();
        return true;
    }

    public boolean overrideResult(String result) {
        if (this.status == TaskStatusEnum.RUNNING) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "Running task result cannot be overridden: " + id);
        }
        if (Objects.equals(this.result, result)) {
            return false;
        }
        this.result = result;
        touch();
        return true;
    }

    /**
     * 人工修正失败信息，仅适用于 failed 任务。
     */
    public boolean overrideError(TaskErrorVO error) {
        if (this.status != TaskStatusEnum.FAILED) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "Error can only be set on a failed task: " + id);
        }
        if (Objects.equals(this.error, error)) {
            return false;
        }
        this.error = error;
        touch();
        return true;
    }

    public void transitTo(TaskStatusEnum target) {
        if (this.status == null || !this.status.canTransitTo(target)) {
            throw invalidTransition(target);
        }
        this.status = target;
        touch();
    }

    public boolean isDispatchable() {
        return this.status == TaskStatusEnum.READY && !this.obsolete;
    }

    public boolean isInfoReference() {
        return this.category == TaskCategoryEnum.INFO_REFERENCE;
    }

    public List<String> safeDependencies() {
        return dependencies == null ? List.of() : dependencies;
    }

    private AppException invalidTransition(TaskStatusEnum target) {
        return new AppException(ResponseCode.INVALID_TRANSITION,
                "Task " + id + " cannot transit from " + (status == null ? null : status.getCode())
                        + " to " + (target == null ? null : target.getCode()));
    }

    private void touch() {
        LocalDateTime now = LocalDateTime.now();
        this.updatedAt = updatedAt != null && updatedAt.isAfter(now) ? updatedAt : now;
    }
}
