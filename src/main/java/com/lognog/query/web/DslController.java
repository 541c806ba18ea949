package com.lognog.query.web;

import com.lognog.query.CompileWarning;
import com.lognog.query.CompiledQuery;
import com.lognog.query.DslCompiler;
import com.lognog.query.TimeRange;
import com.lognog.query.function.FunctionRegistry;
import com.lognog.query.function.FunctionSpec;
import com.lognog.query.resolve.FieldAliases;
import com.lognog.query.resolve.SeverityLevel;
import com.lognog.query.schema.FieldSchema;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DSL endpoints for the query editor: dry-run validation, SQL preview and
 * the language reference.
 *
 * Note: queries are compiled against the default log schema; execution is
 * the search API's job.
 */
@RestController
@RequestMapping("/api/dsl")
public class DslController {

    private final DslCompiler compiler;
    private final FunctionRegistry functionRegistry;

    public DslController(DslCompiler compiler, FunctionRegistry functionRegistry) {
        this.compiler = compiler;
        this.functionRegistry = functionRegistry;
    }

    @PostMapping("/validate")
    public ValidationResponse validate(@RequestBody CompileRequest request) {
        List<CompileWarning> warnings = compiler.validate(request.getQuery(), compiler.getDefaultSchema());
        return new ValidationResponse(true, warnings);
    }

    @PostMapping("/compile")
    public CompiledQuery compile(@RequestBody CompileRequest request) {
        return compiler.compile(request.getQuery(), compiler.getDefaultSchema(), timeRange(request));
    }

    @GetMapping("/functions")
    public Collection<FunctionSpec> listFunctions() {
        return functionRegistry.getAll();
    }

    @GetMapping("/fields")
    public FieldReference listFields() {
        FieldSchema schema = compiler.getDefaultSchema();
        Map<String, Integer> severities = new LinkedHashMap<>();
        for (SeverityLevel level : SeverityLevel.values()) {
            for (String name : level.getNames()) {
                severities.put(name, level.getCode());
            }
        }
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, String> alias : FieldAliases.asMap().entrySet()) {
            if (schema.contains(alias.getValue())) {
                aliases.put(alias.getKey(), alias.getValue());
            }
        }
        return new FieldReference(schema.getFields(), aliases, severities);
    }

    private static TimeRange timeRange(CompileRequest request) {
        if (request.getEarliest() == null && request.getLatest() == null) {
            return null;
        }
        if (request.getEarliest() == null || request.getLatest() == null) {
            throw new IllegalArgumentException("earliest and latest must be given together");
        }
        return new TimeRange(request.getEarliest(), request.getLatest());
    }
}
