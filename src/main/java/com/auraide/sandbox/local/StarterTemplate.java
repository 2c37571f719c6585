package com.auraide.sandbox.local;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Starter files laid down in a new local sandbox.
 */
enum StarterTemplate {

    NODE("node", Map.of(
            "package.json", """
                    {
                      "name": "sandbox-project",
                      "version": "1.0.0",
                      "main": "index.js",
                      "scripts": {
                        "start": "node index.js"
                      }
                    }
                    """,
            "index.js", "console.log(\"Hello from Aura IDE sandbox!\");\n")),

    PYTHON("python", Map.of(
            "main.py", "print(\"Hello from Aura IDE sandbox!\")\n")),

    STATIC("static", Map.of(
            "index.html", """
                    <!DOCTYPE html>
                    <html>
                    <head>
                      <title>Aura IDE Sandbox</title>
                    </head>
                    <body>
                      <h1>Hello from Aura IDE sandbox!</h1>
                    </body>
                    </html>
                    """));

    private final String templateName;
    private final Map<String, String> files;

    StarterTemplate(String templateName, Map<String, String> files) {
        this.templateName = templateName;
        this.files = new LinkedHashMap<>(files);
    }

    static Optional<StarterTemplate> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (StarterTemplate template : values()) {
            if (template.templateName.equalsIgnoreCase(name)) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    String templateName() {
        return templateName;
    }

    void writeTo(Path root) throws IOException {
        for (var entry : files.entrySet()) {
            Files.writeString(root.resolve(entry.getKey()), entry.getValue(), StandardCharsets.UTF_8);
        }
    }
}
