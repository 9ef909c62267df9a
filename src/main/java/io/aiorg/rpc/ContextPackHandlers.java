package io.aiorg.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.aiorg.model.ContextPack;
import io.aiorg.model.ContextPackCategory;
import io.aiorg.storage.MarkdownContextPackStore;

import java.util.ArrayList;
import java.util.List;

final class ContextPackHandlers {
    private ContextPackHandlers() {
    }

    static PackList listContextPacks(HandlerContext ctx, Params params) {
        ContextPackCategory category = params.enumValue("category", ContextPackCategory::fromString, null);
        List<PackSummary> out = new ArrayList<>();
        for (ContextPack p : ctx.contextPacks().list(category)) {
            out.add(PackSummary.of(p));
        }
        return new PackList(out, out.size());
    }

    static Bundle getContext(HandlerContext ctx, Params params) {
        MarkdownContextPackStore.Bundle bundle = ctx.contextPacks().bundle(params.strings("packs"));
        return new Bundle(bundle.content(), bundle.packsFound());
    }

    static PackSummary createContextPack(HandlerContext ctx, Params params) {
        String title = params.require("title");
        ContextPackCategory category = params.enumValue("category", ContextPackCategory::fromString, null);
        if (category == null) {
            params.require("category");
        }
        ContextPack pack = ctx.contextPacks().create(
                title,
                category,
                params.optional("content"),
                params.optional("description"),
                params.strings("tags"));
        return PackSummary.of(pack);
    }

    static PackUpdate addToContextPack(HandlerContext ctx, Params params) {
        String section = params.optional("section");
        ContextPack pack = ctx.contextPacks().append(params.require("pack"), params.require("content"), section);
        return new PackUpdate(pack.id(), pack.title(), section, null);
    }

    static PackUpdate addFileToContextPack(HandlerContext ctx, Params params) {
        String file = params.require("file");
        String section = params.optional("section");
        ContextPack pack = ctx.contextPacks().appendFile(params.require("pack"), file, section);
        return new PackUpdate(pack.id(), pack.title(), section, file);
    }

    record PackList(List<PackSummary> packs, int count) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PackSummary(String id, String title, String category, String description, List<String> tags) {
        static PackSummary of(ContextPack p) {
            return new PackSummary(p.id(), p.title(), p.category().value(), p.description(), p.tags());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record Bundle(String content, List<String> packsFound) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PackUpdate(String id, String title, String section, String file) {
    }
}
