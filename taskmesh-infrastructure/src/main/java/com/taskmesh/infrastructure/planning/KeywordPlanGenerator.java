package com.taskmesh.infrastructure.planning;

import com.taskmesh.domain.plan.adapter.gateway.IPlanGenerator;
import com.taskmesh.domain.plan.model.valobj.TaskDraftVO;
import com.taskmesh.types.enums.ReferenceTypeEnum;
import com.taskmesh.types.enums.ResponseCode;
import com.taskmesh.types.enums.TaskCategoryEnum;
import com.taskmesh.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 关键词规则计划生成器：报告 / 数据分析 / 项目开发 / 通用四种模式。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "planner.mode", havingValue = "rule", matchIfMissing = true)
public class KeywordPlanGenerator implements IPlanGenerator {

    private static final List<String> REPORT_KEYWORDS = List.of("レポート", "report");
    private static final List<String> RESEARCH_KEYWORDS = List.of(
            "情報収集", "調査", "検索", "分析", "市場", "技術動向", "競合",
            "research", "search", "analysis", "market", "trend", "competitor");
    private static final List<String> ANALYSIS_KEYWORDS = List.of(
            "データ分析", "予測", "モデル", "python", "コード", "data analysis", "forecast", "model", "code");
    private static final List<String> PROJECT_KEYWORDS = List.of(
            "プロジェクト", "開発", "webサービス", "システム", "設計",
            "project", "develop", "web service", "system", "design");

    @Override
    public List<TaskDraftVO> generate(String instruction, String priorContext) {
        if (StringUtils.isBlank(instruction)) {
            throw new AppException(ResponseCode.GENERATION_ERROR, "Instruction is empty, cannot generate plan");
        }
        String text = instruction.trim();
        String lower = text.toLowerCase(Locale.ROOT);
        List<TaskDraftVO> drafts = new ArrayList<>();
        if (containsAny(lower, REPORT_KEYWORDS)) {
            if (containsAny(lower, RESEARCH_KEYWORDS)) {
                drafts.add(reference("research", "web", "Collect information needed for: " + text, "research"));
                drafts.add(action("draft", "casual", "Draft the report", List.of("research"), "report"));
            } else {
                drafts.add(action("draft", "casual", "Write report: " + text, List.of(), "report"));
            }
        } else if (containsAny(lower, ANALYSIS_KEYWORDS)) {
            drafts.add(action("analysis", "coder", "Process and analyse data: " + text, List.of(), "analysis"));
            drafts.add(action("summary", "casual", "Write a report of the analysis results",
                    List.of("analysis"), "report", "analysis"));
        } else if (containsAny(lower, PROJECT_KEYWORDS)) {
            drafts.add(reference("research", "web", "Research for project: " + text, "research", "planning"));
            drafts.add(action("design", "casual", "Write the planning and design document",
                    List.of("research"), "planning", "design"));
        } else {
            drafts.add(action("task", "casual", text, List.of(), "general"));
        }
        if (StringUtils.isNotBlank(priorContext)) {
            TaskDraftVO first = drafts.get(0);
            first.setDescription(first.getDescription() + "\n\nBackground: " + priorContext.trim());
        }
        log.debug("Keyword plan generated. taskCount={}, instruction={}", drafts.size(), StringUtils.abbreviate(text, 80));
        return drafts;
    }

    private boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    private TaskDraftVO reference(String ref, String agentType, String description, String... tags) {
        return TaskDraftVO.builder()
                .ref(ref)
                .agentType(agentType)
                .description(description)
                .category(TaskCategoryEnum.INFO_REFERENCE)
                .referenceType(ReferenceTypeEnum.WEB_SEARCH)
                .tags(new ArrayList<>(List.of(tags)))
                .build();
    }

    private TaskDraftVO action(String ref, String agentType, String description, List<String> dependencies, String... tags) {
        return TaskDraftVO.builder()
                .ref(ref)
                .agentType(agentType)
                .description(description)
                .dependencies(new ArrayList<>(dependencies))
                .category(TaskCategoryEnum.ACTION)
                .tags(new ArrayList<>(List.of(tags)))
                .build();
    }
}
