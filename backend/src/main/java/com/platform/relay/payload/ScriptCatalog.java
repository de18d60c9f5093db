package com.platform.relay.payload;

import com.platform.relay.config.RelayProperties;
import com.platform.relay.error.ScriptUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Read-only access to the trusted script directory.
 * Only plain file names are accepted.
 */
@Slf4j
@Component
public class ScriptCatalog {

    private final ResourceLoader resourceLoader;
    private final String directory;

    public ScriptCatalog(ResourceLoader resourceLoader, RelayProperties properties) {
        this.resourceLoader = resourceLoader;
        String configured = properties.getScripts().getDirectory();
        this.directory = configured.endsWith("/") ? configured : configured + "/";
    }

    public String load(String scriptName) {
        if (!isPlainName(scriptName)) {
            throw new ScriptUnavailableException(String.valueOf(scriptName), "invalid script name");
        }

        Resource resource = resourceLoader.getResource(directory + scriptName);
        if (!resource.exists()) {
            throw new ScriptUnavailableException(scriptName, "not found in " + directory);
        }

        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptUnavailableException(scriptName, e);
        }
    }

    public String getDirectory() {
        return directory;
    }

    private static boolean isPlainName(String name) {
        return name != null
            && !name.isBlank()
            && !name.contains("/")
            && !name.contains("\\")
            && !name.contains("..");
    }
}
