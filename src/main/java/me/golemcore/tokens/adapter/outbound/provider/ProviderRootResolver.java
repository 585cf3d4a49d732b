package me.golemcore.tokens.adapter.outbound.provider;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves the directories a provider scans.
 *
 * <p>
 * A set provider-specific environment variable replaces every default
 * location. Otherwise all default locations contribute: home-relative
 * directories, {@code $XDG_CONFIG_HOME} (else {@code ~/.config}) and
 * {@code $XDG_DATA_HOME} (else {@code ~/.local/share}). Without a home
 * directory and without an override a provider has no roots.
 */
public class ProviderRootResolver {

    public enum BaseDirectory {
        HOME, CONFIG, DATA, CACHE
    }

    /**
     * A default location: a base directory plus a relative path below it.
     */
    public record DefaultRoot(BaseDirectory base, String relativePath) {

        public static DefaultRoot home(String relativePath) {
            return new DefaultRoot(BaseDirectory.HOME, relativePath);
        }

        public static DefaultRoot config(String relativePath) {
            return new DefaultRoot(BaseDirectory.CONFIG, relativePath);
        }

        public static DefaultRoot data(String relativePath) {
            return new DefaultRoot(BaseDirectory.DATA, relativePath);
        }
    }

    private final Function<String, String> environment;
    private final Path home;

    public ProviderRootResolver(Function<String, String> environment, Path home) {
        this.environment = Objects.requireNonNull(environment);
        this.home = home;
    }

    public static ProviderRootResolver fromSystem() {
        Path home = homeDirectory(System::getenv, System.getProperty("user.home"));
        return new ProviderRootResolver(System::getenv, home);
    }

    /**
     * {@code $HOME} when set, else the {@code user.home} system property.
     */
    static Path homeDirectory(Function<String, String> environment, String userHome) {
        String home = environment.apply("HOME");
        if (home == null || home.isBlank()) {
            home = userHome;
        }
        return home == null || home.isBlank() ? null : Paths.get(home);
    }

    /**
     * @param overrideVariable
     *            environment variable replacing the defaults, may be null
     * @param overrideSubPath
     *            path joined to the override value, may be null
     */
    public List<Path> resolve(String overrideVariable, String overrideSubPath, List<DefaultRoot> defaults) {
        String override = overrideVariable != null ? env(overrideVariable) : null;
        if (override != null) {
            Path root = Paths.get(override);
            return List.of(overrideSubPath != null ? root.resolve(overrideSubPath) : root);
        }

        List<Path> roots = new ArrayList<>();
        for (DefaultRoot defaultRoot : defaults) {
            Path base = baseDirectory(defaultRoot.base());
            if (base == null) {
                continue;
            }
            Path root = base.resolve(defaultRoot.relativePath());
            if (!roots.contains(root)) {
                roots.add(root);
            }
        }
        return roots;
    }

    /**
     * @return the base directory, or null when it cannot be determined
     */
    public Path baseDirectory(BaseDirectory base) {
        return switch (base) {
        case HOME -> home;
        case CONFIG -> xdg("XDG_CONFIG_HOME", ".config");
        case DATA -> xdg("XDG_DATA_HOME", ".local/share");
        case CACHE -> xdg("XDG_CACHE_HOME", ".cache");
        };
    }

    private Path xdg(String variable, String homeFallback) {
        String value = env(variable);
        if (value != null) {
            return Paths.get(value);
        }
        return home != null ? home.resolve(homeFallback) : null;
    }

    private String env(String name) {
        String value = environment.apply(name);
        return value == null || value.isBlank() ? null : value;
    }
}
