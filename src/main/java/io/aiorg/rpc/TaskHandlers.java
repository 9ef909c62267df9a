package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.aiorg.model.Person;
import io.aiorg.model.Project;
import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;
import io.aiorg.storage.TaskStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

final class TaskHandlers {
    private static final String TODAY = "today";
    private static final String OVERDUE = "overdue";

    private TaskHandlers() {
    }

    static TaskList listTasks(HandlerContext ctx, Params params) {
        String status = params.optional("status");
        String project = params.optional("project");
        LocalDate today = ctx.today();
        List<Task> tasks;
        if (status == null) {
            tasks = ctx.cache().list(null);
        } else if (TODAY.equalsIgnoreCase(status)) {
            tasks = ctx.cache().listToday(today);
        } else if (OVERDUE.equalsIgnoreCase(status)) {
            tasks = ctx.cache().listOverdue(today);
        } else {
            tasks = ctx.cache().list(params.enumValue("status", TaskStatus::fromString, null));
        }
        if (project != null) {
            String needle = project.toLowerCase(Locale.ROOT);
            List<Task> filtered = new ArrayList<>();
            for (Task t : tasks) {
                if (t.project() != null && t.project().toLowerCase(Locale.ROOT).contains(needle)) {
                    filtered.add(t);
                }
            }
            tasks = filtered;
        }
        return new TaskList(views(tasks, today), tasks.size());
    }

    static TaskResult getTask(HandlerContext ctx, Params params) {
        String query = params.require("query");
        Task task = ctx.cache().get(query).orElseGet(() -> ctx.tasks().find(query));
        return new TaskResult(TaskView.of(task, ctx.today()));
    }

    static TaskResult addTask(HandlerContext ctx, Params params) {
        String title = params.require("title");
        LocalDate due = params.date("due");
        TaskStatus status = params.enumValue("status", TaskStatus::fromString, TaskStatus.INBOX);
        String project = params.optional("project");
        String projectLink = null;
        if (project != null) {
            if (project.startsWith("[[")) {
                projectLink = project;
            } else {
                Project found = ctx.projects().find(project);
                projectLink = ctx.projects().link(found);
            }
        }
        String assign = params.optional("assign");
        Person assignee = assign == null ? null : ctx.people().find(assign);

        Task task = ctx.tasks().create(new TaskStore.NewTask(title, due, projectLink, status, params.strings("tags")));
        if (assignee != null) {
            task = ctx.tasks().waitOn(task.id(), ctx.people().link(assignee));
        }
        ctx.cache().refresh();
        return new TaskResult(TaskView.of(task, ctx.today()));
    }

    static TaskResult completeTask(HandlerContext ctx, Params params) {
        Task task = ctx.tasks().complete(params.require("query"));
        ctx.cache().refresh();
        return new TaskResult(TaskView.of(task, ctx.today()));
    }

    static TaskResult startTask(HandlerContext ctx, Params params) {
        Task task = ctx.tasks().start(params.require("query"));
        ctx.cache().refresh();
        return new TaskResult(TaskView.of(task, ctx.today()));
    }

    static TaskResult deferTask(HandlerContext ctx, Params params) {
        Task task = ctx.tasks().defer(params.require("query"));
        ctx.cache().refresh();
        return new TaskResult(TaskView.of(task, ctx.today()));
    }

    static Delegated delegateTask(HandlerContext ctx, Params params) {
        String query = params.require("query");
        Person person = ctx.people().find(params.require("person"));
        Task task = ctx.tasks().waitOn(query, ctx.people().link(person));
        ctx.cache().refresh();
        return new Delegated(TaskView.of(task, ctx.today()), person.name());
    }

    private static List<TaskView> views(List<Task> tasks, LocalDate today) {
        List<TaskView> out = new ArrayList<>(tasks.size());
        for (Task t : tasks) {
            out.add(TaskView.of(t, today));
        }
        return out;
    }

    record TaskList(List<TaskView> tasks, int count) {
    }

    record TaskResult(TaskView task) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Delegated(TaskView task, String delegatedTo) {
    }
}
