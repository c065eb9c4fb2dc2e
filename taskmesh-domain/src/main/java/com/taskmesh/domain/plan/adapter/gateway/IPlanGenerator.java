package com.taskmesh.domain.plan.adapter.gateway;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.entity.TaskPlanEntity;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;

import java.util.List;

/**
 * 计划生成器。失败时抛出 GENERATION_ERROR。
 */
public interface IPlanGenerator {

    /**
     * 由指令（和可选的前置上下文）生成初始任务草稿。
     */
    List<TaskDraftVO> generate(String instruction, String priorContext);

    /**
     * 动态重规划：任务完成后追加的草稿，默认不追加。
     */
    default List<TaskDraftVO> extend(TaskPlanEntity plan, PlanTaskEntity completedTask) {
        return List.of();
    }
}
