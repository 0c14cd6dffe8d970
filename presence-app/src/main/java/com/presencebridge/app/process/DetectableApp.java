package com.presencebridge.app.process;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One catalog entry: an application id and the executable names that reveal
 * it is running.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectableApp {

    private String id;
    private String name;
    private List<String> executables = new ArrayList<>();

    /**
     * Case-insensitive match on the file name of {@code executable}; entries
     * may be bare names or end with a path suffix such as {@code bin/game}.
     */
    public boolean matches(String executable) {
        if (executable == null || executables == null) {
            return false;
        }
        String candidate = executable.replace('\\', '/').toLowerCase(Locale.ROOT);
        for (String exe : executables) {
            if (exe == null || exe.isBlank()) {
                continue;
            }
            String wanted = exe.replace('\\', '/').toLowerCase(Locale.ROOT);
            if (candidate.equals(wanted) || candidate.endsWith("/" + wanted)) {
                return true;
            }
        }
        return false;
    }
}
