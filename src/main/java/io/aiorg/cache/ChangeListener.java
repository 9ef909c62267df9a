package io.aiorg.cache;

import java.nio.file.Path;

public interface ChangeListener {

    void onChange(Path path);

    void onOverflow();
}
