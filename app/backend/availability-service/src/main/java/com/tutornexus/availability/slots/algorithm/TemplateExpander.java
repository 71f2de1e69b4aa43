package com.tutornexus.availability.slots.algorithm;

import com.tutornexus.availability.common.entity.WeeklyTemplate;
import com.tutornexus.availability.common.util.ScheduleTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands weekly templates into dated slot drafts.
 *
 * Output order is fixed (templates by teacher, day, start time and id, then by date),
 * so the same templates and window always yield the same list. The diff and therefore the
 * whole sync rely on that.
 */
@Component
@Slf4j
public class TemplateExpander {

    private static final Comparator<WeeklyTemplate> TEMPLATE_ORDER = Comparator
            .comparing(WeeklyTemplate::getTeacherId)
            .thenComparing(WeeklyTemplate::getDayOfWeek)
            .thenComparing(WeeklyTemplate::getStartTime)
            .thenComparing(WeeklyTemplate::getTemplateId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * @param templates   templates to expand; inactive, fixed and incomplete ones are skipped
     * @param windowStart any day of the first week (aligned to its Sunday)
     * @param daysAhead   horizon in days, end inclusive
     * @return drafts in deterministic order
     */
    public List<SlotDraft> generateInstances(List<WeeklyTemplate> templates, LocalDate windowStart, int daysAhead) {
        return generateInstances(templates, SyncWindow.of(windowStart, daysAhead));
    }

    public List<SlotDraft> generateInstances(List<WeeklyTemplate> templates, SyncWindow window) {
        List<WeeklyTemplate> expandable = templates.stream()
                .filter(WeeklyTemplate::isActiveTemplate)
                .filter(template -> !template.isFixedTemplate())
                .filter(this::isComplete)
                .sorted(TEMPLATE_ORDER)
                .collect(Collectors.toList());

        List<SlotDraft> drafts = new ArrayList<>();
        LocalDate end = window.getEnd();

        for (WeeklyTemplate template : expandable) {
            LocalDate date = window.getWeekStart()
                    .with(TemporalAdjusters.nextOrSame(ScheduleTimes.toDayOfWeek(template.getDayOfWeek())));

            while (!date.isAfter(end)) {
                drafts.add(SlotDraft.builder()
                        .naturalKey(NaturalKey.of(template.getTeacherId(), date, template.getStartTime()))
                        .teacherId(template.getTeacherId())
                        .date(date)
                        .startTime(template.getStartTime())
                        .endTime(template.getEndTime())
                        .type(template.getType())
                        .durationMinutes(template.getDurationMinutes())
                        .createdFromTemplateId(template.getTemplateId())
                        .dayOfWeek(template.getDayOfWeek())
                        .build());
                date = date.plusWeeks(1);
            }
        }

        log.debug("Expanded {} templates into {} drafts ({} ~ {})",
                expandable.size(), drafts.size(), window.getWeekStart(), end);
        return drafts;
    }

    private boolean isComplete(WeeklyTemplate template) {
        boolean complete = template.getTeacherId() != null && !template.getTeacherId().isBlank()
                && template.getDayOfWeek() != null
                && template.getDayOfWeek() >= 0 && template.getDayOfWeek() <= 6
                && template.getStartTime() != null
                && template.getEndTime() != null
                && template.getStartTime().isBefore(template.getEndTime());
        if (!complete) {
            log.warn("Skipping invalid template {}: missing or inconsistent required fields (teacherId={}, dayOfWeek={}, {}~{})",
                    template.getTemplateId(), template.getTeacherId(), template.getDayOfWeek(),
                    template.getStartTime(), template.getEndTime());
        }
        return complete;
    }
}
