/**
 * Task 领域 - 依赖解析与重试策略
 *
 * <p>DependencyResolverDomainService 为纯函数，每次状态变更后重新运行。</p>
 */
package com.taskmesh.domain.task;
