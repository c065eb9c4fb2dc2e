package com.taskmesh.test.domain;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.service.PlanGraphDomainService;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.taskmesh.test.support.PlanEngineFixtures.task;

public class PlanGraphDomainServiceTest {

    private final PlanGraphDomainService service = new PlanGraphDomainService();

    @Test
    public void shouldAcceptDiamondGraph() {
        Assertions.assertDoesNotThrow(() -> service.validate(List.of(
                task("A", "web"),
                task("B", "coder", "A"),
                task("C", "casual", "A"),
                task("D", "casual", "B", "C"))));
    }

    @Test
    public void shouldRejectSelfDependency() {
        assertInvalidGraph(List.of(task("A", "web", "A")));
    }

    @Test
    public void shouldRejectMissingDependency() {
        assertInvalidGraph(List.of(task("A", "web"), task("B", "web", "Z")));
    }

    @Test
    public void shouldRejectDuplicateTaskId() {
        assertInvalidGraph(List.of(task("A", "web"), task("A", "coder")));
    }

    @Test
    public void shouldRejectCycle() {
        assertInvalidGraph(List.of(
                task("A", "web", "C"),
                task("B", "web", "A"),
                task("C", "web", "B")));
    }

    @Test
    public void shouldRejectEveryBackEdgeAddedToRandomDag() {
        Random random = new Random(20260902L);
        for (int round = 0; round < 200; round++) {
            int size = 2 + random.nextInt(10);
            List<PlanTaskEntity> tasks = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                PlanTaskEntity node = task("n" + i, "casual");
                for (int j = 0; j < i; j++) {
                    if (random.nextInt(3) == 0) {
                        node.getDependencies().add("n" + j);
                    }
                }
                tasks.add(node);
            }
            // 保证存在 n0 -> ... -> n(size-1) 的路径
            for (int i = 1; i < size; i++) {
                if (!tasks.get(i).getDependencies().contains("n" + (i - 1))) {
                    tasks.get(i).getDependencies().add("n" + (i - 1));
                }
            }
            service.validate(tasks);

            int from = random.nextInt(size - 1);
            int to = from + 1 + random.nextInt(size - from - 1);
            tasks.get(from).getDependencies().add("n" + to);
            assertInvalidGraph(tasks);
        }
    }

    private void assertInvalidGraph(List<PlanTaskEntity> tasks) {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.validate(tasks));
        Assertions.assertEquals(ResponseCode.INVALID_GRAPH.getCode(), ex.getCode());
    }
}
