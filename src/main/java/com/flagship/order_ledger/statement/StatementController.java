package com.flagship.order_ledger.statement;

import com.flagship.order_ledger.common.EntityRole;
import com.flagship.order_ledger.statement.dto.StatementRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
public class StatementController {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private final StatementBuilder statementBuilder;
    private final JdbcStatementSource statementSource;

    /**
     * Builds a statement from entries supplied by the caller.
     */
    @PostMapping
    public ResponseEntity<Statement> buildStatement(@Valid @RequestBody StatementRequest request) {
        return ResponseEntity.ok(statementBuilder.buildStatement(request.getEntries(), request.getEntityRole()));
    }

    /**
     * Builds the statement of a stored customer or supplier.
     */
    @GetMapping("/{role}/{entityId}")
    public ResponseEntity<Statement> getStatement(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable("role") EntityRole role,
            @PathVariable("entityId") UUID entityId) {
        return ResponseEntity.ok(statementBuilder.buildStatement(
            statementSource.loadEntries(tenantId, role, entityId), role));
    }
}
