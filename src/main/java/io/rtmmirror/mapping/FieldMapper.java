package io.rtmmirror.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rtmmirror.model.DefectDetails;
import io.rtmmirror.model.ExecutionMeta;
import io.rtmmirror.model.Issue;
import io.rtmmirror.model.IssueFields;
import io.rtmmirror.model.IssueKind;
import io.rtmmirror.model.KindDetails;
import io.rtmmirror.model.RequirementDetails;
import io.rtmmirror.model.Step;
import io.rtmmirror.model.TestCaseDetails;
import io.rtmmirror.model.TestExecutionDetails;
import io.rtmmirror.model.TestPlanDetails;
import io.rtmmirror.util.Jsons;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Translates between the remote RTM issue JSON and the local normalized record. Both directions
 * are pure. Inbound mapping is total: absent or oddly shaped values become empty values plus a
 * warning, never an exception.
 */
public final class FieldMapper {
    private static final String STEP_ACTION = "Action";
    private static final String STEP_INPUT = "Input";
    private static final String STEP_EXPECTED = "Expected";

    public MappedIssue toLocal(IssueKind kind, JsonNode payload) {
        List<String> warnings = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            warnings.add(kind + " payload is not a JSON object");
            return new MappedIssue(kind, null, null, "", IssueFields.empty(), KindDetails.emptyFor(kind),
                    List.of(), Map.of(), ExecutionMeta.empty(), List.of(), warnings);
        }
        String remoteKey = firstText(payload, "testKey", "key", "jiraKey");
        IssueFields fields = new IssueFields(
                text(payload, "summary", warnings),
                text(payload, "description", warnings),
                named(payload, "status", warnings),
                named(payload, "priority", warnings),
                person(payload, "assigneeId", "assignee", warnings),
                person(payload, "reporterId", "reporter", warnings),
                stringList(payload, "labels", warnings),
                namedList(payload, "components", warnings),
                namedList(payload, "versions", warnings),
                flatText(payload, "environment"),
                text(payload, "dueDate", warnings),
                flatText(payload, "timeEstimate"),
                text(payload, "created", warnings),
                text(payload, "updated", warnings)
        );
        KindDetails details = switch (kind) {
            case REQUIREMENT -> new RequirementDetails(text(payload, "epicName", warnings),
                    integer(payload, "issueTypeId", warnings));
            case TEST_CASE -> new TestCaseDetails(text(payload, "preconditions", warnings));
            case TEST_PLAN -> new TestPlanDetails();
            case TEST_EXECUTION -> new TestExecutionDetails(
                    keyOf(payload.get("testPlan")),
                    named(payload, "result", warnings),
                    named(payload, "executeTransition", warnings));
            case DEFECT -> new DefectDetails(integer(payload, "issueTypeId", warnings));
        };
        List<Step> steps = kind == IssueKind.TEST_CASE ? steps(payload, warnings) : List.of();
        Map<LinkField, List<String>> links = new EnumMap<>(LinkField.class);
        for (LinkField field : LinkField.values()) {
            if (field.ownerKind() == kind && payload.has(field.jsonField())) {
                links.put(field, linkKeys(payload.get(field.jsonField()), field, warnings));
            }
        }
        ExecutionMeta meta = ExecutionMeta.empty();
        List<ExecutionRef> executions = List.of();
        if (kind == IssueKind.TEST_EXECUTION) {
            meta = new ExecutionMeta(
                    fields.environment(),
                    text(payload, "startDate", warnings),
                    text(payload, "endDate", warnings),
                    ((TestExecutionDetails) details).result(),
                    person(payload, "executedBy", "executor", warnings)
            );
            executions = executions(payload.get("testCaseExecutions"), warnings);
        }
        return new MappedIssue(
                kind,
                remoteKey.isEmpty() ? null : remoteKey,
                remoteId(payload),
                firstText(payload, "parentTestKey"),
                fields,
                details,
                steps,
                links,
                meta,
                executions,
                warnings
        );
    }

    /**
     * Builds a create/update payload. Read-only fields (keys, creation and update stamps, the
     * reporter) are never written even when the local record carries them. Link fields are
     * written under exactly the verb the caller chose; one field may carry {@code add} and
     * {@code remove} together, {@code set} always stands alone.
     */
    public ObjectNode toRemote(IssueKind kind, LocalRecord record) {
        Issue issue = record.issue();
        if (issue.kind() != kind) {
            throw new IllegalArgumentException("Cannot map a " + issue.kind() + " issue as " + kind);
        }
        IssueFields f = issue.fields();
        ObjectNode out = Jsons.mapper().createObjectNode();
        putIfPresent(out, "projectKey", record.projectKey());
        putIfPresent(out, "parentTestKey", record.parentTestKey());
        out.put("summary", f.summary());
        out.put("description", f.description());
        putIfPresent(out, "assigneeId", f.assignee());
        putNamed(out, "priority", f.priority());
        putNamed(out, "status", f.status());
        ArrayNode labels = out.putArray("labels");
        f.labels().forEach(labels::add);
        ArrayNode components = out.putArray("components");
        f.components().forEach(name -> components.addObject().put("name", name));
        ArrayNode versions = out.putArray("versions");
        f.versions().forEach(name -> versions.addObject().put("name", name));
        putIfPresent(out, "environment", f.environment());
        putIfPresent(out, "dueDate", f.dueDate());
        putIfPresent(out, "timeEstimate", f.timeEstimate());

        KindDetails details = issue.details();
        if (details instanceof RequirementDetails r) {
            putIfPresent(out, "epicName", r.epicName());
            if (r.issueTypeId() != null) {
                out.put("issueTypeId", r.issueTypeId());
            }
        } else if (details instanceof TestCaseDetails t) {
            putIfPresent(out, "preconditions", t.preconditions());
            out.set("stepGroups", stepGroups(record.steps()));
        } else if (details instanceof TestExecutionDetails t) {
            if (!t.testPlanKey().isEmpty()) {
                out.putObject("testPlan").put("testKey", t.testPlanKey());
            }
            putNamed(out, "result", t.result());
            putNamed(out, "executeTransition", t.executeTransition());
            ExecutionMeta meta = record.executionMeta();
            putIfPresent(out, "startDate", meta.startDate());
            putIfPresent(out, "endDate", meta.endDate());
            putIfPresent(out, "executedBy", meta.executedBy());
            if (!record.executions().isEmpty()) {
                ArrayNode rows = out.putArray("testCaseExecutions");
                for (ExecutionRef ref : record.executions()) {
                    ObjectNode row = rows.addObject();
                    row.put("testCaseKey", ref.testCaseKey());
                    row.put("order", ref.orderNo());
                    putIfPresent(row, "assignee", ref.assignee());
                    putIfPresent(row, "result", ref.result());
                    putIfPresent(row, "environment", ref.environment());
                    putIfPresent(row, "defects", ref.defects());
                    if (ref.actualTime() != null) {
                        row.put("actualTime", ref.actualTime());
                    }
                }
            }
        } else if (details instanceof DefectDetails d && d.issueTypeId() != null) {
            out.put("issueTypeId", d.issueTypeId());
        }

        for (LinkUpdate update : record.links()) {
            if (update.field().ownerKind() != kind) {
                throw new IllegalArgumentException(
                        update.field().jsonField() + " is not a link field of " + kind);
            }
            String name = update.field().jsonField();
            ObjectNode linkNode = out.get(name) instanceof ObjectNode existing ? existing : out.putObject(name);
            if (linkNode.has(update.verb().wireName())) {
                throw new IllegalArgumentException(name + " carries two " + update.verb().wireName() + " updates");
            }
            if ((update.verb() == LinkVerb.SET && linkNode.size() > 0) || linkNode.has(LinkVerb.SET.wireName())) {
                throw new IllegalArgumentException(name + " cannot combine set with add or remove");
            }
            ArrayNode keys = linkNode.putArray(update.verb().wireName());
            update.keys().forEach(key -> keys.addObject().put("testKey", key));
        }
        return out;
    }

    // ---------------------------------------------------------------- inbound helpers

    private static String text(JsonNode payload, String field, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText("");
        }
        warnings.add("Field '" + field + "' is not a scalar, ignored");
        return "";
    }

    // Scalars as text, structured values as compact JSON.
    private static String flatText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText("") : Jsons.toCompactJson(node);
    }

    private static String firstText(JsonNode payload, String... fields) {
        for (String field : fields) {
            JsonNode node = payload.get(field);
            if (node != null && node.isValueNode() && !node.asText("").isBlank()) {
                return node.asText().trim();
            }
        }
        return "";
    }

    // {id, name} objects, falling back to statusName, or a bare string.
    private static String named(JsonNode payload, String field, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            String name = firstText(node, "name", "statusName", "value");
            if (name.isEmpty() && node.size() > 0) {
                warnings.add("Field '" + field + "' has no name");
            }
            return name;
        }
        if (node.isValueNode()) {
            return node.asText("");
        }
        warnings.add("Field '" + field + "' has an unexpected shape, ignored");
        return "";
    }

    private static String person(JsonNode payload, String idField, String objectField, List<String> warnings) {
        String id = firstText(payload, idField);
        if (!id.isEmpty()) {
            return id;
        }
        JsonNode node = payload.get(objectField);
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            return firstText(node, "displayName", "name", "key", "id");
        }
        if (node.isValueNode()) {
            return node.asText("");
        }
        warnings.add("Field '" + objectField + "' has an unexpected shape, ignored");
        return "";
    }

    private static List<String> stringList(JsonNode payload, String field, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            warnings.add("Field '" + field + "' is not an array, ignored");
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            String value = item.isValueNode() ? item.asText("") : firstText(item, "name", "id");
            if (!value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    // [{id, name}] lists: the name wins, the id is the fallback.
    private static List<String> namedList(JsonNode payload, String field, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            warnings.add("Field '" + field + "' is not an array, ignored");
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            String value = item.isObject() ? firstText(item, "name", "id") : item.asText("");
            if (!value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private static Integer integer(JsonNode payload, String field, List<String> warnings) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                warnings.add("Field '" + field + "' is not a number: " + node.asText());
                return null;
            }
        }
        warnings.add("Field '" + field + "' is not a number, ignored");
        return null;
    }

    private static Long remoteId(JsonNode payload) {
        for (String field : new String[]{"issueId", "jiraId", "id"}) {
            JsonNode node = payload.get(field);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.canConvertToLong()) {
                return node.asLong();
            }
            if (node.isTextual() && node.asText().trim().matches("-?\\d+")) {
                return Long.parseLong(node.asText().trim());
            }
        }
        return null;
    }

    private static String keyOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isObject()) {
            return firstText(node, "testKey", "key", "jiraKey");
        }
        return node.isValueNode() ? node.asText("").trim() : "";
    }

    // Lists of keys or {testKey} objects; a {set|add|remove} wrapper is read through its set list.
    private static List<String> linkKeys(JsonNode node, LinkField field, List<String> warnings) {
        JsonNode list = node;
        if (node != null && node.isObject()) {
            list = node.has("set") ? node.get("set") : node.path(field.jsonField());
        }
        if (list == null || list.isNull() || list.isMissingNode()) {
            return List.of();
        }
        if (!list.isArray()) {
            warnings.add("Link field '" + field.jsonField() + "' is not a list, ignored");
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : list) {
            String key = keyOf(item);
            if (!key.isEmpty() && !out.contains(key)) {
                out.add(key);
            }
        }
        return out;
    }

    private static List<Step> steps(JsonNode payload, List<String> warnings) {
        List<Step> out = new ArrayList<>();
        JsonNode groups = payload.get("stepGroups");
        if (groups != null && groups.isArray()) {
            int groupNo = 0;
            for (JsonNode group : groups) {
                groupNo++;
                if (!group.isObject()) {
                    warnings.add("Step group " + groupNo + " is not an object, skipped");
                    continue;
                }
                if (group.path("steps").isArray()) {
                    int orderNo = 0;
                    for (JsonNode step : group.get("steps")) {
                        Step parsed = fromColumns(step.path("stepColumns"), groupNo, orderNo + 1);
                        if (parsed != null) {
                            out.add(parsed);
                            orderNo++;
                        }
                    }
                } else if (group.has("stepColumns")) {
                    Step parsed = fromColumns(group.get("stepColumns"), groupNo, 1);
                    if (parsed != null) {
                        out.add(parsed);
                    }
                }
            }
            return out;
        }
        JsonNode raw = payload.get("steps");
        if (raw == null || raw.isNull()) {
            return out;
        }
        if (!raw.isArray()) {
            warnings.add("Field 'steps' is not an array, ignored");
            return out;
        }
        int groupNo = 0;
        for (JsonNode group : raw) {
            groupNo++;
            if (group.isArray()) {
                // Two-dimensional form: each cell is a step whose value is the action.
                int orderNo = 0;
                for (JsonNode cell : group) {
                    String value = RichText.toPlain(cell.isObject() ? cell.path("value").asText("") : cell.asText(""));
                    orderNo++;
                    out.add(new Step(groupNo, orderNo, value, "", ""));
                }
            } else if (group.isObject()) {
                Step parsed = group.has("stepColumns")
                        ? fromColumns(group.get("stepColumns"), groupNo, 1)
                        : fromPlainObject(group, groupNo);
                if (parsed != null) {
                    out.add(parsed);
                }
            }
        }
        return out;
    }

    private static Step fromColumns(JsonNode columns, int groupNo, int orderNo) {
        String action = "";
        String input = "";
        String expected = "";
        if (columns.isArray()) {
            for (JsonNode column : columns) {
                String name = column.path("name").asText("").toLowerCase(Locale.ROOT);
                String value = RichText.toPlain(column.path("value").asText(""));
                if (name.contains("action") || name.contains("step")) {
                    action = value;
                } else if (name.contains("input") || name.contains("data")) {
                    input = value;
                } else if (name.contains("expected") || name.contains("result") || name.contains("output")) {
                    expected = value;
                }
            }
        } else if (columns.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = columns.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String name = entry.getKey().toLowerCase(Locale.ROOT);
                String value = RichText.toPlain(entry.getValue().asText(""));
                if (name.contains("action") || name.contains("step")) {
                    action = value;
                } else if (name.contains("input") || name.contains("data")) {
                    input = value;
                } else if (name.contains("expected") || name.contains("result") || name.contains("output")) {
                    expected = value;
                }
            }
        }
        if (action.isEmpty() && expected.isEmpty()) {
            return null;
        }
        return new Step(groupNo, orderNo, action, input, expected);
    }

    private static Step fromPlainObject(JsonNode step, int groupNo) {
        String action = RichText.toPlain(firstText(step, "action", "step"));
        String input = RichText.toPlain(firstText(step, "data", "input"));
        String expected = RichText.toPlain(firstText(step, "expectedResult", "expected"));
        if (action.isEmpty() && expected.isEmpty()) {
            return null;
        }
        return new Step(groupNo, 1, action, input, expected);
    }

    private static List<ExecutionRef> executions(JsonNode node, List<String> warnings) {
        List<ExecutionRef> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        JsonNode items = node.isObject() && node.has("testCases") ? node.get("testCases") : node;
        if (!items.isArray()) {
            warnings.add("Field 'testCaseExecutions' is not an array, ignored");
            return out;
        }
        int index = 0;
        for (JsonNode item : items) {
            index++;
            if (!item.isObject()) {
                continue;
            }
            String testCaseKey = firstText(item, "testCaseKey", "testcase_key", "key");
            if (testCaseKey.isEmpty()) {
                testCaseKey = keyOf(item.get("testCase"));
            }
            if (testCaseKey.isEmpty()) {
                warnings.add("Test case execution " + index + " has no test case key, skipped");
                continue;
            }
            JsonNode order = item.has("order") ? item.get("order") : item.get("orderNo");
            int orderNo = order != null && order.canConvertToInt() && order.asInt() > 0 ? order.asInt() : index;
            String result = named(item, "result", warnings);
            if (result.isEmpty()) {
                result = named(item, "status", warnings);
            }
            JsonNode actual = item.has("actualTime") ? item.get("actualTime") : item.get("actual_time");
            out.add(new ExecutionRef(
                    testCaseKey,
                    orderNo,
                    person(item, "assigneeId", "assignee", warnings),
                    result,
                    flatText(item, "environment"),
                    defects(item.get("defects")),
                    actual != null && actual.canConvertToLong() ? actual.asLong() : null,
                    firstText(item, "testCaseExecutionKey", "tceKey", "executionKey", "testKey")
            ));
        }
        return out;
    }

    private static String defects(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isArray()) {
            return node.asText("");
        }
        List<String> keys = new ArrayList<>();
        for (JsonNode item : node) {
            String key = keyOf(item);
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return String.join(", ", keys);
    }

    // ---------------------------------------------------------------- outbound helpers

    private static void putIfPresent(ObjectNode out, String field, String value) {
        if (value != null && !value.isBlank()) {
            out.put(field, value);
        }
    }

    private static void putNamed(ObjectNode out, String field, String value) {
        if (value != null && !value.isBlank()) {
            out.putObject(field).put("name", value);
        }
    }

    private static ArrayNode stepGroups(List<Step> steps) {
        ArrayNode groups = Jsons.mapper().createArrayNode();
        Map<Integer, ArrayNode> byGroup = new TreeMap<>();
        for (Step step : steps) {
            ArrayNode groupSteps = byGroup.computeIfAbsent(step.groupNo(), g -> Jsons.mapper().createArrayNode());
            ArrayNode columns = groupSteps.addObject().putArray("stepColumns");
            columns.addObject().put("name", STEP_ACTION).put("value", RichText.toHtml(step.action()));
            columns.addObject().put("name", STEP_INPUT).put("value", RichText.toHtml(step.input()));
            columns.addObject().put("name", STEP_EXPECTED).put("value", RichText.toHtml(step.expected()));
        }
        for (Map.Entry<Integer, ArrayNode> entry : byGroup.entrySet()) {
            ObjectNode group = groups.addObject();
            group.put("name", "Group " + entry.getKey());
            group.set("steps", entry.getValue());
        }
        return groups;
    }
}
