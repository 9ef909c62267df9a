package io.aiorg.dashboard;

import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class DashboardRenderer {
    static final int STALE_AFTER_DAYS = 7;

    private static final DateTimeFormatter HEADING = DateTimeFormatter.ofPattern("EEEE, MMMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_NAME = DateTimeFormatter.ofPattern("EEEE", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);

    private final Clock clock;

    public DashboardRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(List<Task> openTasks, LocalDate date) {
        List<Task> overdue = new ArrayList<>();
        List<Task> dueToday = new ArrayList<>();
        List<Task> dueThisWeek = new ArrayList<>();
        List<Task> blocked = new ArrayList<>();
        Map<String, List<Task>> waitingByPerson = new LinkedHashMap<>();
        LocalDate weekEnd = date.plusDays(7);

        for (Task task : openTasks) {
            if (task.status() == TaskStatus.COMPLETED) {
                continue;
            }
            LocalDate due = task.due();
            if (due != null) {
                if (due.isBefore(date)) {
                    overdue.add(task);
                } else if (due.isEqual(date)) {
                    dueToday.add(task);
                } else if (!due.isAfter(weekEnd)) {
                    dueThisWeek.add(task);
                }
            }
            if (!task.blockedBy().isEmpty()) {
                blocked.add(task);
            }
            if (task.status() == TaskStatus.WAITING) {
                String person = task.waitingOn() == null ? "Unknown" : task.waitingOn();
                waitingByPerson.computeIfAbsent(person, k -> new ArrayList<>()).add(task);
            }
        }

        StringBuilder md = new StringBuilder();
        line(md, "---");
        line(md, "type: dashboard");
        line(md, "date: " + date);
        line(md, "generated: " + LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
        line(md, "---");
        line(md, "");
        line(md, "# " + HEADING.format(date));
        line(md, "");

        if (!overdue.isEmpty()) {
            table(md, "Overdue", "| Task | Due | ID |", "|------|-----|------|");
            for (Task t : overdue) {
                line(md, "| " + t.title() + " | " + relative(t.due(), date) + " | " + t.id() + " |");
            }
            line(md, "");
        }
        if (!dueToday.isEmpty()) {
            table(md, "Due Today", "| Task | Project | ID |", "|------|---------|------|");
            for (Task t : dueToday) {
                line(md, "| " + t.title() + " | " + linkName(t.project(), "") + " | " + t.id() + " |");
            }
            line(md, "");
        }
        if (!dueThisWeek.isEmpty()) {
            table(md, "Due This Week", "| Task | Due | Project | ID |", "|------|-----|---------|------|");
            for (Task t : dueThisWeek) {
                line(md, "| " + t.title() + " | " + relative(t.due(), date) + " | "
                        + linkName(t.project(), "") + " | " + t.id() + " |");
            }
            line(md, "");
        }
        if (!blocked.isEmpty()) {
            table(md, "Blocked", "| Task | Blocked By | ID |", "|------|------------|------|");
            for (Task t : blocked) {
                line(md, "| " + t.title() + " | " + String.join(", ", t.blockedBy()) + " | " + t.id() + " |");
            }
            line(md, "");
        }
        if (!waitingByPerson.isEmpty()) {
            line(md, "---");
            line(md, "");
            line(md, "## Waiting For");
            line(md, "");
            LocalDateTime now = LocalDateTime.now(clock);
            for (Map.Entry<String, List<Task>> e : waitingByPerson.entrySet()) {
                line(md, "### " + linkName(e.getKey(), "Unknown") + " (" + e.getValue().size() + " items)");
                line(md, "");
                for (Task t : e.getValue()) {
                    long days = t.updated() == null ? 0 : Duration.between(t.updated(), now).toDays();
                    line(md, "- [" + t.id() + "] " + t.title() + " (" + days + "d)"
                            + (days > STALE_AFTER_DAYS ? " [STALE]" : ""));
                }
                line(md, "");
            }
        }

        line(md, "---");
        line(md, "");
        line(md, "## Quick Links");
        line(md, "");
        line(md, "| View | Link |");
        line(md, "|------|------|");
        line(md, "| Inbox | [[AIO/Tasks/Inbox/]] |");
        line(md, "| Next Actions | [[AIO/Tasks/Next/]] |");
        md.append("| All Projects | [[AIO/Projects/]] |");
        return md.toString();
    }

    // "yesterday", "3 days ago", "tomorrow", a day name within the week, else "Jan 15".
    static String relative(LocalDate due, LocalDate today) {
        long delta = ChronoUnit.DAYS.between(today, due);
        if (delta < -1) {
            return Math.abs(delta) + " days ago";
        }
        if (delta == -1) {
            return "yesterday";
        }
        if (delta == 0) {
            return "today";
        }
        if (delta == 1) {
            return "tomorrow";
        }
        if (delta < 7) {
            return DAY_NAME.format(due);
        }
        if (delta < 14) {
            return "next " + DAY_NAME.format(due);
        }
        return SHORT_DATE.format(due);
    }

    static String linkName(String link, String fallback) {
        if (link == null || link.isBlank()) {
            return fallback;
        }
        String name = link.replace("[[", "").replace("]]", "");
        int slash = name.lastIndexOf('/');
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private static void table(StringBuilder md, String title, String header, String rule) {
        line(md, "## " + title);
        line(md, "");
        line(md, header);
        line(md, rule);
    }

    private static void line(StringBuilder md, String text) {
        md.append(text).append('\n');
    }
}
