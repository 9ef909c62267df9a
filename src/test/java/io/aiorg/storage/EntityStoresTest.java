package io.aiorg.storage;

import io.aiorg.TestVaults;
import io.aiorg.config.AiorgConfig;
import io.aiorg.error.InvalidParamsException;
import io.aiorg.error.PersonNotFoundException;
import io.aiorg.error.ProjectNotFoundException;
import io.aiorg.model.Person;
import io.aiorg.model.Project;
import io.aiorg.model.ProjectStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class EntityStoresTest {

    @Test
    void projectFindResolvesSubstringAndSuggestsOnMiss() throws Exception {
        Path root = TestVaults.create("aiorg-projects-");
        try {
            AiorgConfig config = TestVaults.config(root);
            MarkdownProjectStore projects = new MarkdownProjectStore(config, new EntityIds(config), TestVaults.clock());
            Project created = projects.create("Q4 Migration", ProjectStatus.ACTIVE, "Platform");

            Assertions.assertTrue(Files.isRegularFile(config.projectsDir().resolve("Q4-Migration.md")));
            Assertions.assertEquals(created.id(), projects.find("migration").id());
            Assertions.assertEquals(created.id(), projects.find(created.id()).id());
            Assertions.assertEquals("[[AIO/Projects/Q4-Migration]]", projects.link(created));

            ProjectNotFoundException miss = Assertions.assertThrows(ProjectNotFoundException.class,
                    () -> projects.find("Q4 Migratoin"));
            Assertions.assertEquals(List.of("Q4-Migration"), miss.suggestions());
            Assertions.assertThrows(InvalidParamsException.class, () -> projects.find(" "));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void projectListFiltersByStatus() throws Exception {
        Path root = TestVaults.create("aiorg-projects-");
        try {
            AiorgConfig config = TestVaults.config(root);
            MarkdownProjectStore projects = new MarkdownProjectStore(config, new EntityIds(config), TestVaults.clock());
            projects.create("Beta Launch", ProjectStatus.ACTIVE, null);
            projects.create("Alpha Cleanup", ProjectStatus.ON_HOLD, null);

            Assertions.assertEquals(2, projects.listAll(null).size());
            Assertions.assertEquals("Alpha Cleanup", projects.listAll(null).get(0).title());
            Assertions.assertEquals(1, projects.listAll(ProjectStatus.ON_HOLD).size());
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }

    @Test
    void personFindNormalizesNamesAndHintsOnMiss() throws Exception {
        Path root = TestVaults.create("aiorg-people-");
        try {
            AiorgConfig config = TestVaults.config(root);
            MarkdownPersonStore people = new MarkdownPersonStore(config, new EntityIds(config));
            Person sarah = people.create("Sarah Chen", "Platform", "Lead", "sarah@example.com");

            Assertions.assertEquals(sarah.id(), people.find("sarah-chen").id());
            Assertions.assertEquals(sarah.id(), people.find("chen").id());
            Assertions.assertEquals("[[AIO/People/Sarah-Chen]]", people.link(sarah));

            PersonNotFoundException miss = Assertions.assertThrows(PersonNotFoundException.class, () -> people.find("Sarha"));
            Assertions.assertTrue(miss.getMessage().contains("did you mean: Sarah Chen"));
        } finally {
            TestVaults.deleteRecursively(root);
        }
    }
}
