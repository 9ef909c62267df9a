package io.aiorg.rpc;

import io.aiorg.error.InvalidDateException;
import io.aiorg.model.Task;
import io.aiorg.model.TaskStatus;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

final class DashboardHandlers {
    private DashboardHandlers() {
    }

    // An unparseable date falls back to today rather than failing the call.
    static Dashboard getDashboard(HandlerContext ctx, Params params) {
        LocalDate date;
        try {
            date = params.date("date");
        } catch (InvalidDateException e) {
            date = null;
        }
        if (date == null) {
            date = ctx.today();
        }
        List<Task> open = new ArrayList<>();
        for (Task t : ctx.cache().all()) {
            if (t.status() != TaskStatus.COMPLETED && t.status() != TaskStatus.SOMEDAY) {
                open.add(t);
            }
        }
        return new Dashboard(ctx.dashboard().render(open, date), date.toString());
    }

    record Dashboard(String content, String date) {
    }
}
