/**
 * Plan 领域 - 计划存储域
 *
 * <p>职责：按会话保存计划与任务，校验依赖图，原子地应用状态流转</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.taskmesh.domain.plan.model.entity.TaskPlanEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>PlanStoreService - 计划 CRUD 与 compare-and-swap 写入</li>
 *   <li>PlanGraphDomainService - 依赖图校验</li>
 *   <li>PlanDraftDomainService - 草稿转任务</li>
 *   <li>PlanProgressDomainService - 进度统计</li>
 * </ul>
 *
 * @author taskmesh
 * @since 2026-09-02
 */
package com.taskmesh.domain.plan;
