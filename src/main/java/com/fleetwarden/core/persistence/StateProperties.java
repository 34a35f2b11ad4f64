package com.fleetwarden.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Location of the small JSON state files shared by every Fleetwarden process on the machine.
 */
@Component
@ConfigurationProperties(prefix = "fleetwarden.state")
public class StateProperties {

    private String dir = System.getProperty("user.home") + "/.fleetwarden";

    public String getDir() { return dir; }
    public void setDir(String dir) { this.dir = dir; }

    public Path resolve(String fileName) {
        return Path.of(dir).resolve(fileName);
    }
}
