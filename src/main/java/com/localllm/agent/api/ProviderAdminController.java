package com.localllm.agent.api;

import com.localllm.agent.model.ProviderRequest;
import com.localllm.agent.model.ProviderResponse;
import com.localllm.agent.model.ProviderUpdateRequest;
import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.provider.ProviderRegistry;
import com.localllm.agent.supervisor.ConnectionStatus;
import com.localllm.agent.supervisor.ConnectionSupervisor;
import com.localllm.agent.tool.ToolDefinition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Provider administration.
 *
 * GET    /api/v1/providers              list with live status
 * GET    /api/v1/providers/{id}
 * POST   /api/v1/providers              add
 * PATCH  /api/v1/providers/{id}         partial update
 * DELETE /api/v1/providers/{id}         built-ins answer 409
 * POST   /api/v1/providers/{id}/enable | /disable
 * GET    /api/v1/providers/{id}/status
 * GET    /api/v1/providers/{id}/tools   connects if needed
 * POST   /api/v1/providers/reload       re-read the config file
 */
@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
@Slf4j
public class ProviderAdminController {

    private final ProviderRegistry registry;
    private final ConnectionSupervisor supervisor;

    @GetMapping
    public List<ProviderResponse> list() {
        return registry.list().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public ProviderResponse get(@PathVariable String id) {
        return toResponse(registry.get(id));
    }

    @PostMapping
    public ResponseEntity<ProviderResponse> add(@Valid @RequestBody ProviderRequest request) {
        log.info("Add provider request [provider={}, transport={}]", request.getId(), request.getTransport());
        ProviderConfig added = registry.add(request.toConfig());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(added));
    }

    @PatchMapping("/{id}")
    public ProviderResponse update(@PathVariable String id, @Valid @RequestBody ProviderUpdateRequest request) {
        log.info("Update provider request [provider={}]", id);
        return toResponse(registry.update(id, request.toPatch()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        log.info("Remove provider request [provider={}]", id);
        registry.remove(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/enable")
    public ProviderResponse enable(@PathVariable String id) {
        return toResponse(registry.setEnabled(id, true));
    }

    @PostMapping("/{id}/disable")
    public ProviderResponse disable(@PathVariable String id) {
        return toResponse(registry.setEnabled(id, false));
    }

    @GetMapping("/{id}/status")
    public ConnectionStatus status(@PathVariable String id) {
        registry.get(id);
        return supervisor.status(id);
    }

    @GetMapping("/{id}/tools")
    public List<ToolDefinition> tools(@PathVariable String id) {
        registry.get(id);
        return supervisor.describeTools(id);
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        List<String> changed = registry.reload();
        return Map.of("providers", registry.list().size(), "changed", changed);
    }

    private ProviderResponse toResponse(ProviderConfig config) {
        return ProviderResponse.from(config, supervisor.status(config.getId()));
    }
}
