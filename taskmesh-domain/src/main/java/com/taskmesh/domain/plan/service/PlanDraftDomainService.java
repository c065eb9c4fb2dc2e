package com.taskmesh.domain.plan.service;

import com.taskmesh.domain.plan.model.entity.PlanTaskEntity;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskCategoryEnum;
import com.taskmesh.types.enums.TaskStatusEnum;
import com.taskmesh.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 草稿转任务：分配稳定 id（task-001 / info-002，按计划内位置编号），
 * 将草稿内引用翻译为任务 id。
 */
@Service
public class PlanDraftDomainService {

    private static final Pattern SEQUENCED_ID = Pattern.compile("^(?:task|info)-(\\d{1,9})$");

    public List<PlanTaskEntity> toTasks(Collection<PlanTaskEntity> existingTasks, List<TaskDraftVO> drafts) {
        Set<String> existingIds = new HashSet<>();
        if (existingTasks != null) {
            existingTasks.forEach(task -> existingIds.add(task.getId()));
        }
        if (drafts == null || drafts.isEmpty()) {
            return new ArrayList<>();
        }

        int sequence = nextSequence(existingIds);
        Map<String, String> refToId = new HashMap<>();
        List<String> assignedIds = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraftVO draft = drafts.get(i);
            TaskCategoryEnum category = draft.getCategory() == null ? TaskCategoryEnum.ACTION : draft.getCategory();
            String id = String.format("%s-%03d", category.idPrefix(), sequence++);
            while (existingIds.contains(id)) {
                id = String.format("%s-%03d", category.idPrefix(), sequence++);
            }
            assignedIds.add(id);
            String ref = StringUtils.defaultIfBlank(draft.getRef(), id);
            if (refToId.put(ref, id) != null) {
                throw new AppException(ResponseCode.INVALID_GRAPH, "Duplicate draft reference: " + ref);
            }
        }

        // 同一批内任务共用创建时间，派发顺序由 id 决定
        LocalDateTime now = LocalDateTime.now();
        List<PlanTaskEntity> tasks = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraftVO draft = drafts.get(i);
            PlanTaskEntity task = new PlanTaskEntity();
            task.setId(assignedIds.get(i));
            task.setAgentType(StringUtils.trimToNull(draft.getAgentType()));
            task.setDescription(StringUtils.defaultString(draft.getDescription()));
            task.setCategory(draft.getCategory() == null ? TaskCategoryEnum.ACTION : draft.getCategory());
            task.setReferenceType(task.isInfoReference() ? draft.getReferenceType() : null);
            task.setTags(draft.getTags() == null ? new ArrayList<>() : new ArrayList<>(draft.getTags()));
            task.setDependencies(resolveDependencies(draft, refToId, existingIds));
            task.setStatus(TaskStatusEnum.PENDING);
            task.setCreatedAt(now);
            task.setUpdatedAt(now);
            tasks.add(task);
        }
        return tasks;
    }

    /**
     * 编号从计划位置与已有 task-NNN / info-NNN 最大编号中较大者之后开始，调用方自带 id 时不会撞号。
     */
    private int nextSequence(Set<String> existingIds) {
        int highest = existingIds.size();
        for (String id : existingIds) {
            Matcher matcher = SEQUENCED_ID.matcher(StringUtils.defaultString(id));
            if (matcher.matches()) {
                highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
            }
        }
        return highest + 1;
    }

    private List<String> resolveDependencies(TaskDraftVO draft, Map<String, String> refToId, Set<String> existingIds) {
        List<String> resolved = new ArrayList<>();
        if (draft.getDependencies() == null) {
            return resolved;
        }
        for (String ref : draft.getDependencies()) {
            String id = refToId.get(ref);
            if (id == null && existingIds.contains(ref)) {
                id = ref;
            }
            if (id == null) {
                throw new AppException(ResponseCode.INVALID_GRAPH,
                        "Draft " + draft.getRef() + " references unknown dependency " + ref);
            }
            if (!resolved.contains(id)) {
                resolved.add(id);
            }
        }
        return resolved;
    }
}
