package me.golemcore.tokens.adapter.outbound.provider;

import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.BaseDirectory;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.DefaultRoot;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRootResolverTest {

    private static final Path HOME = Path.of("/home/alice");

    private final Map<String, String> env = new HashMap<>();

    private ProviderRootResolver resolver(Path home) {
        return new ProviderRootResolver(env::get, home);
    }

    @Test
    void overrideReplacesAllDefaults() {
        env.put("CODEX_HOME", "/opt/codex");

        List<Path> roots = resolver(HOME).resolve("CODEX_HOME", "sessions",
                List.of(DefaultRoot.home(".codex/sessions"), DefaultRoot.config("codex/sessions")));

        assertEquals(List.of(Path.of("/opt/codex/sessions")), roots);
    }

    @Test
    void blankOverrideIsIgnored() {
        env.put("CODEX_HOME", "  ");

        List<Path> roots = resolver(HOME).resolve("CODEX_HOME", "sessions",
                List.of(DefaultRoot.home(".codex/sessions")));

        assertEquals(List.of(HOME.resolve(".codex/sessions")), roots);
    }

    @Test
    void allDefaultsContributeWithXdgFallbacks() {
        List<Path> roots = resolver(HOME).resolve(null, null,
                List.of(DefaultRoot.home(".claude/projects"), DefaultRoot.config("claude/projects"),
                        DefaultRoot.data("amp/threads")));

        assertEquals(List.of(
                HOME.resolve(".claude/projects"),
                HOME.resolve(".config/claude/projects"),
                HOME.resolve(".local/share/amp/threads")), roots);
    }

    @Test
    void xdgVariablesWinOverHomeFallbacks() {
        env.put("XDG_CONFIG_HOME", "/xdg/config");
        env.put("XDG_DATA_HOME", "/xdg/data");
        env.put("XDG_CACHE_HOME", "/xdg/cache");

        ProviderRootResolver resolver = resolver(HOME);

        assertEquals(Path.of("/xdg/config"), resolver.baseDirectory(BaseDirectory.CONFIG));
        assertEquals(Path.of("/xdg/data"), resolver.baseDirectory(BaseDirectory.DATA));
        assertEquals(Path.of("/xdg/cache"), resolver.baseDirectory(BaseDirectory.CACHE));
    }

    @Test
    void noHomeAndNoOverrideMeansNoHomeRoots() {
        List<Path> roots = resolver(null).resolve("PI_AGENT_DIR", "sessions",
                List.of(DefaultRoot.home(".pi/agent/sessions"), DefaultRoot.config("pi/agent/sessions")));

        assertTrue(roots.isEmpty());
    }

    @Test
    void duplicateDefaultsAreCollapsed() {
        env.put("XDG_CONFIG_HOME", HOME.toString());

        List<Path> roots = resolver(HOME).resolve(null, null,
                List.of(DefaultRoot.home("tool"), DefaultRoot.config("tool")));

        assertEquals(List.of(HOME.resolve("tool")), roots);
    }

    @Test
    void homeEnvironmentVariableWinsOverUserHome() {
        env.put("HOME", "/x");

        assertEquals(Path.of("/x"), ProviderRootResolver.homeDirectory(env::get, "/home/alice"));
    }

    @Test
    void blankHomeFallsBackToUserHome() {
        env.put("HOME", " ");

        assertEquals(HOME, ProviderRootResolver.homeDirectory(env::get, "/home/alice"));
        assertNull(ProviderRootResolver.homeDirectory(name -> null, null));
    }
}
