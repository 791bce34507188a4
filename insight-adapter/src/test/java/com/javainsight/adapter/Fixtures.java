package com.javainsight.adapter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Framework-style sources shared by adapter tests. */
public final class Fixtures {

    public static final String FOO_SERVICE = String.join("\n",
        "package com.android.server;",
        "",
        "import java.util.List;",
        "",
        "/** Starts the foo service. */",
        "public class FooService extends SystemService {",
        "    private static final int MAX = 3, MIN = 1;",
        "    String name;",
        "",
        "    public FooService(Context context) {",
        "        super(context);",
        "    }",
        "",
        "    @Override",
        "    public void onStart() {",
        "        publishBinderService(\"foo\", new FooBinder());",
        "        helper(1, 2);",
        "    }",
        "",
        "    @Override",
        "    public void onBootPhase(int phase) {",
        "        if (phase == PHASE_SYSTEM_SERVICES_READY) {",
        "            helper(phase, 0);",
        "        }",
        "    }",
        "",
        "    private static int helper(int a, int b) {",
        "        return a + b;",
        "    }",
        "",
        "    private native void nativeInit();",
        "",
        "    interface Callback {",
        "        void done(int code);",
        "    }",
        "",
        "    class Inner {",
        "        void run() {}",
        "    }",
        "}",
        "");

    public static final String SYSTEM_SERVER = String.join("\n",
        "package com.android.server;",
        "",
        "public final class SystemServer {",
        "    private void startOtherServices() {",
        "    }",
        "",
        "    public static void main(String[] args) {",
        "        new SystemServer().run();",
        "    }",
        "",
        "    private void startBootstrapServices() {",
        "    }",
        "",
        "    private void run() {",
        "        startBootstrapServices();",
        "        startOtherServices();",
        "    }",
        "}",
        "");

    private Fixtures() {}

    public static Path write(Path root, String relativePath, String content) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /** 1-based line holding the first occurrence of {@code text}. */
    public static int lineOf(String source, String text) {
        int index = source.indexOf(text);
        if (index < 0) {
            throw new IllegalArgumentException("Not in source: " + text);
        }
        return (int) source.substring(0, index).chars().filter(c -> c == '\n').count() + 1;
    }
}
