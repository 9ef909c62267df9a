package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.aiorg.model.Person;
import io.aiorg.model.Project;
import io.aiorg.model.ProjectStatus;

import java.util.ArrayList;
import java.util.List;

final class ProjectHandlers {
    private ProjectHandlers() {
    }

    static ProjectList listProjects(HandlerContext ctx, Params params) {
        ProjectStatus status = params.enumValue("status", ProjectStatus::fromString, null);
        List<ProjectSummary> out = new ArrayList<>();
        for (Project p : ctx.projects().listAll(status)) {
            out.add(ProjectSummary.of(p));
        }
        return new ProjectList(out, out.size());
    }

    static ProjectSummary createProject(HandlerContext ctx, Params params) {
        String name = params.require("name");
        ProjectStatus status = params.enumValue("status", ProjectStatus::fromString, ProjectStatus.ACTIVE);
        return ProjectSummary.of(ctx.projects().create(name, status, params.optional("team")));
    }

    static PersonList listPeople(HandlerContext ctx, Params params) {
        List<PersonSummary> out = new ArrayList<>();
        for (Person p : ctx.people().listAll()) {
            out.add(new PersonSummary(p.id(), p.name(), p.team(), p.role(), p.email()));
        }
        return new PersonList(out, out.size());
    }

    static PersonSummary createPerson(HandlerContext ctx, Params params) {
        Person p = ctx.people().create(
                params.require("name"),
                params.optional("team"),
                params.optional("role"),
                params.optional("email"));
        return new PersonSummary(p.id(), p.name(), p.team(), p.role(), p.email());
    }

    record ProjectList(List<ProjectSummary> projects, int count) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProjectSummary(String id, String title, String status, String team) {
        static ProjectSummary of(Project p) {
            return new ProjectSummary(p.id(), p.title(), p.status().value(), p.team());
        }
    }

    record PersonList(List<PersonSummary> people, int count) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PersonSummary(String id, String name, String team, String role, String email) {
    }
}
