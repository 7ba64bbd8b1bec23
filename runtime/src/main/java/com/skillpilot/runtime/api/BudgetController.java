package com.skillpilot.runtime.api;

import com.skillpilot.runtime.api.dto.AllocateRequest;
import com.skillpilot.runtime.api.dto.AllocateResponse;
import com.skillpilot.runtime.api.dto.BudgetResponse;
import com.skillpilot.runtime.api.dto.BudgetTotalsResponse;
import com.skillpilot.runtime.api.dto.UseRequest;
import com.skillpilot.runtime.budget.BudgetAllocator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Admin API over the priority-aware budget allocator.
 *
 * POST   /budgets/{name}            — allocate, body {requested, priority?}
 * POST   /budgets/{name}/use        — consume tokens, body {tokens}
 * DELETE /budgets/{name}            — release
 * POST   /budgets/rebalance         — rebalance now
 * GET    /budgets                   — all budgets
 * GET    /budgets/{name}            — one budget
 * GET    /budgets/totals            — pool totals
 */
@RestController
@RequestMapping("/budgets")
public class BudgetController {

    private final BudgetAllocator allocator;

    public BudgetController(BudgetAllocator allocator) {
        this.allocator = allocator;
    }

    @PostMapping("/{name}")
    public AllocateResponse allocate(@PathVariable String name, @RequestBody AllocateRequest req) {
        int priority = req.priority() == null ? BudgetAllocator.DEFAULT_PRIORITY : req.priority();
        int granted = allocator.allocate(name, req.requested(), priority);
        return new AllocateResponse(name, req.requested(), granted, priority);
    }

    /**
     * Returns 409 when the skill has no budget or not enough remains; the
     * caller must shrink its request or allocate more.
     */
    @PostMapping("/{name}/use")
    public ResponseEntity<Map<String, Object>> use(@PathVariable String name, @RequestBody UseRequest req) {
        boolean accepted = allocator.use(name, req.tokens());
        return ResponseEntity.status(accepted ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(Map.of("skill", name, "tokens", req.tokens(), "accepted", accepted));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> release(@PathVariable String name) {
        if (!allocator.release(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No budget allocated for: " + name);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/rebalance")
    public List<BudgetResponse> rebalance() {
        allocator.rebalance();
        return all();
    }

    @GetMapping
    public List<BudgetResponse> all() {
        return allocator.getAllBudgets().stream()
                .map(BudgetResponse::from)
                .toList();
    }

    @GetMapping("/totals")
    public BudgetTotalsResponse totals() {
        int allocated = allocator.getTotalAllocated();
        return new BudgetTotalsResponse(
                allocator.getTotalBudget(),
                allocated,
                allocator.getTotalUsed(),
                allocator.getTotalBudget() - allocated);
    }

    @GetMapping("/{name}")
    public BudgetResponse get(@PathVariable String name) {
        return allocator.getBudget(name)
                .map(BudgetResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No budget allocated for: " + name));
    }
}
