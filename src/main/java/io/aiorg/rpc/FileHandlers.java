package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.storage.VaultFiles;

final class FileHandlers {
    private FileHandlers() {
    }

    static FileContent fileGet(HandlerContext ctx, Params params) {
        VaultFiles.Content found = ctx.files().get(params.require("query"));
        return new FileContent(found.file(), found.content());
    }

    static FileWritten fileSet(HandlerContext ctx, Params params) {
        String query = params.require("query");
        String content = params.text("content");
        if (content == null) {
            throw new InvalidParamsException("Missing required parameter: content");
        }
        VaultFiles.Written written = ctx.files().set(query, content);
        if (written.underTasks()) {
            ctx.cache().refresh();
        }
        return new FileWritten(written.file(), written.backup());
    }

    record FileContent(String file, String content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FileWritten(String file, String backup) {
    }
}
