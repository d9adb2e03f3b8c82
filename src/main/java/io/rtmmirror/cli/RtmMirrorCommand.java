package io.rtmmirror.cli;

import io.rtmmirror.config.RemoteSettings;
import io.rtmmirror.config.RtmMirrorConfig;
import io.rtmmirror.mapping.FieldMapper;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.Project;
import io.rtmmirror.model.SyncCheckpoint;
import io.rtmmirror.model.TreeNode;
import io.rtmmirror.observability.SyncAuditLog;
import io.rtmmirror.remote.HttpRemoteIssueService;
import io.rtmmirror.remote.RemoteIssueService;
import io.rtmmirror.storage.ChildReplacer;
import io.rtmmirror.storage.Database;
import io.rtmmirror.storage.RecordStore;
import io.rtmmirror.storage.SyncStateTracker;
import io.rtmmirror.sync.CancellationSignal;
import io.rtmmirror.sync.PullPolicy;
import io.rtmmirror.sync.ReconcileMode;
import io.rtmmirror.sync.SyncEngine;
import io.rtmmirror.sync.SyncReport;
import io.rtmmirror.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "rtm-mirror",
        mixinStandardHelpOptions = true,
        description = "Local mirror of a remote RTM issue tree",
        subcommands = {
                RtmMirrorCommand.InitCommand.class,
                RtmMirrorCommand.ProjectAddCommand.class,
                RtmMirrorCommand.ProjectsCommand.class,
                RtmMirrorCommand.PullCommand.class,
                RtmMirrorCommand.PullIssueCommand.class,
                RtmMirrorCommand.PushCommand.class,
                RtmMirrorCommand.StatusCommand.class,
                RtmMirrorCommand.TreeCommand.class,
                RtmMirrorCommand.PurgeTombstonesCommand.class,
                RtmMirrorCommand.SchemaMigrationsCommand.class,
                RtmMirrorCommand.AuditTailCommand.class,
                RtmMirrorCommand.AuditVerifyCommand.class
        }
)
public final class RtmMirrorCommand implements Runnable {
    @Option(names = {"--root"}, description = "Mirror data root directory", defaultValue = RtmMirrorConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | project-add | projects | pull | pull-issue | push | status | tree | purge-tombstones | schema-migrations | audit-tail | audit-verify");
    }

    Workspace workspace() {
        RtmMirrorConfig config = RtmMirrorConfig.fromRoot(root);
        Database database = new Database(config);
        database.init();
        return new Workspace(config, database, new RecordStore(database), new ChildReplacer(database),
                new SyncStateTracker(database), new SyncAuditLog(config.auditFile()));
    }

    record Workspace(
            RtmMirrorConfig config,
            Database database,
            RecordStore store,
            ChildReplacer replacer,
            SyncStateTracker tracker,
            SyncAuditLog auditLog
    ) {
        RemoteSettings settings() {
            return RemoteSettings.load(config.settingsFile());
        }

        SyncEngine engine(String baseUrlOverride) {
            RemoteSettings settings = settings();
            if (baseUrlOverride != null && !baseUrlOverride.isBlank()) {
                settings = settings.withBaseUrl(baseUrlOverride);
            }
            RemoteIssueService remote = new HttpRemoteIssueService(settings);
            return new SyncEngine(store, replacer, tracker, remote, new FieldMapper(), auditLog);
        }

        Optional<Project> project(String key) {
            return store.findProject(key);
        }
    }

    private static int projectNotFound(String key) {
        System.out.println("{\"error\":\"project not found: " + key + "\"}");
        return 1;
    }

    private static int printReport(SyncReport report) {
        System.out.println(Jsons.toJson(report));
        return report.failures().isEmpty() ? 0 : 2;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Project local = ws.store().localProject();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", ws.config().rootDir().toString());
            out.put("db", ws.config().dbFile().toString());
            out.put("local_project_id", local.id());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "project-add", description = "Register a remote project (idempotent)")
    static final class ProjectAddCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--key"}, required = true, description = "Remote project key")
        String key;

        @Option(names = {"--remote-id"}, required = true, description = "Remote numeric project id")
        long remoteId;

        @Option(names = {"--name"}, defaultValue = "", description = "Display name")
        String name;

        @Option(names = {"--base-url"}, defaultValue = "", description = "Remote base URL the project lives on")
        String baseUrl;

        @Override
        public Integer call() {
            Project project = parent.workspace().store().getOrCreateProject(key, remoteId, name, baseUrl);
            System.out.println(Jsons.toJson(project));
            return 0;
        }
    }

    @Command(name = "projects", description = "List registered projects")
    static final class ProjectsCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.workspace().store().listProjects()));
            return 0;
        }
    }

    @Command(name = "pull", description = "Pull remote trees into the local mirror")
    static final class PullCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project key")
        String projectKey;

        @Option(names = {"--mode"}, defaultValue = "full", description = "full|structure")
        String mode;

        @Option(names = {"--skip-dirty"}, description = "Leave records with unpushed edits untouched")
        boolean skipDirty;

        @Option(names = {"--kind"}, split = ",", description = "Kind scopes to pull, e.g. requirements,test-cases")
        List<String> kinds;

        @Option(names = {"--base-url"}, description = "Override the configured remote base URL")
        String baseUrl;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Optional<Project> project = ws.project(projectKey);
            if (project.isEmpty()) {
                return projectNotFound(projectKey);
            }
            List<IssueKind> scopes = new ArrayList<>();
            if (kinds == null || kinds.isEmpty()) {
                scopes.addAll(ws.settings().treeKinds());
            } else {
                kinds.forEach(raw -> scopes.add(IssueKind.fromString(raw)));
            }
            ReconcileMode reconcileMode = "structure".equals(mode.trim().toLowerCase(Locale.ROOT))
                    ? ReconcileMode.STRUCTURE_ONLY
                    : ReconcileMode.FULL;
            SyncReport report = ws.engine(baseUrl).pull(
                    project.get(),
                    scopes,
                    reconcileMode,
                    skipDirty ? PullPolicy.SKIP_DIRTY : PullPolicy.OVERWRITE,
                    CancellationSignal.none()
            );
            return printReport(report);
        }
    }

    @Command(name = "pull-issue", description = "Re-fetch one remote-bound issue by local id")
    static final class PullIssueCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Parameters(index = "0", description = "Local issue id")
        long issueId;

        @Option(names = {"--base-url"}, description = "Override the configured remote base URL")
        String baseUrl;

        @Override
        public Integer call() {
            return printReport(parent.workspace().engine(baseUrl).pullIssue(issueId));
        }
    }

    @Command(name = "push", description = "Push dirty records to the remote service")
    static final class PushCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project key")
        String projectKey;

        @Option(names = {"--base-url"}, description = "Override the configured remote base URL")
        String baseUrl;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Optional<Project> project = ws.project(projectKey);
            if (project.isEmpty()) {
                return projectNotFound(projectKey);
            }
            return printReport(ws.engine(baseUrl).pushDirty(project.get(), CancellationSignal.none()));
        }
    }

    @Command(name = "status", description = "Show record counts and sync checkpoints of a project")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project key")
        String projectKey;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Optional<Project> project = ws.project(projectKey);
            if (project.isEmpty()) {
                return projectNotFound(projectKey);
            }
            RecordStore.StatusCounts counts = ws.store().statusCounts(project.get().id());
            SyncCheckpoint checkpoint = ws.tracker().checkpoint(project.get().id());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("project", project.get());
            out.put("counts", counts);
            out.put("checkpoint", checkpoint);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "tree", description = "Print the local folder/issue tree of one kind scope")
    static final class TreeCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project key")
        String projectKey;

        @Option(names = {"--kind"}, required = true, description = "Issue kind, e.g. test-cases")
        String kind;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Optional<Project> project = ws.project(projectKey);
            if (project.isEmpty()) {
                return projectNotFound(projectKey);
            }
            List<TreeNode> tree = ws.store().fetchTree(project.get().id(), IssueKind.fromString(kind));
            System.out.println(Jsons.toJson(tree));
            return 0;
        }
    }

    @Command(name = "purge-tombstones", description = "Physically remove tombstoned records that need no push")
    static final class PurgeTombstonesCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project key")
        String projectKey;

        @Override
        public Integer call() {
            Workspace ws = parent.workspace();
            Optional<Project> project = ws.project(projectKey);
            if (project.isEmpty()) {
                return projectNotFound(projectKey);
            }
            RecordStore.PurgeResult result = ws.store().purgeTombstoned(project.get().id());
            ws.auditLog().log(SyncAuditLog.AuditEvent.of(
                    "store.purge",
                    projectKey,
                    "project/" + projectKey,
                    "ok",
                    Map.of("issues_purged", result.issuesPurged(), "folders_purged", result.foldersPurged())
            ));
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.workspace().database().listSchemaMigrations(limit)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show the last audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.workspace().auditLog().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        RtmMirrorCommand parent;

        @Override
        public Integer call() {
            SyncAuditLog.ChainVerification verification = parent.workspace().auditLog().verifyChain();
            System.out.println(Jsons.toJson(verification));
            return verification.valid() ? 0 : 1;
        }
    }
}
