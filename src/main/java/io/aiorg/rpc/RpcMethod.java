package io.aiorg.rpc;

import java.util.Optional;

public enum RpcMethod {
    LIST_TASKS("list_tasks", TaskHandlers::listTasks),
    GET_TASK("get_task", TaskHandlers::getTask),
    ADD_TASK("add_task", TaskHandlers::addTask),
    COMPLETE_TASK("complete_task", TaskHandlers::completeTask),
    START_TASK("start_task", TaskHandlers::startTask),
    DEFER_TASK("defer_task", TaskHandlers::deferTask),
    DELEGATE_TASK("delegate_task", TaskHandlers::delegateTask),
    GET_DASHBOARD("get_dashboard", DashboardHandlers::getDashboard),
    LIST_PROJECTS("list_projects", ProjectHandlers::listProjects),
    CREATE_PROJECT("create_project", ProjectHandlers::createProject),
    LIST_PEOPLE("list_people", ProjectHandlers::listPeople),
    CREATE_PERSON("create_person", ProjectHandlers::createPerson),
    LIST_CONTEXT_PACKS("list_context_packs", ContextPackHandlers::listContextPacks),
    GET_CONTEXT("get_context", ContextPackHandlers::getContext),
    CREATE_CONTEXT_PACK("create_context_pack", ContextPackHandlers::createContextPack),
    ADD_TO_CONTEXT_PACK("add_to_context_pack", ContextPackHandlers::addToContextPack),
    ADD_FILE_TO_CONTEXT_PACK("add_file_to_context_pack", ContextPackHandlers::addFileToContextPack),
    FILE_GET("file_get", FileHandlers::fileGet),
    FILE_SET("file_set", FileHandlers::fileSet);

    private final String wireName;
    private final RpcHandler handler;

    RpcMethod(String wireName, RpcHandler handler) {
        this.wireName = wireName;
        this.handler = handler;
    }

    public String wireName() {
        return wireName;
    }

    RpcHandler handler() {
        return handler;
    }

    public static Optional<RpcMethod> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (RpcMethod m : values()) {
            if (m.wireName.equals(name)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
