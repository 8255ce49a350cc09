package org.Aayush.association.solver;

import org.Aayush.association.core.AssociationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Solver lookup by id.
 *
 * <p>{@code OPTIMAL} and {@code GREEDY} are always present. Extra solvers are registered after
 * them, so an extra solver reusing a built-in id replaces it. Solvers are stateless and shared.</p>
 */
public final class AssignmentSolverRegistry {
    public static final String SOLVER_OPTIMAL = HungarianAssignmentSolver.ID;
    public static final String SOLVER_GREEDY = GreedyAssignmentSolver.ID;

    private static final AssignmentSolverRegistry BUILT_INS = new AssignmentSolverRegistry(List.of());

    private final Map<String, AssignmentSolver> solversById;

    /**
     * @param extraSolvers solvers registered after the built-ins; null means none.
     * @throws IllegalArgumentException when a solver reports a null or blank id.
     */
    public AssignmentSolverRegistry(Collection<? extends AssignmentSolver> extraSolvers) {
        Map<String, AssignmentSolver> byId = new LinkedHashMap<>();
        register(byId, new HungarianAssignmentSolver());
        register(byId, new GreedyAssignmentSolver());
        if (extraSolvers != null) {
            extraSolvers.forEach(solver -> register(byId, solver));
        }
        this.solversById = Collections.unmodifiableMap(byId);
    }

    /**
     * Shared registry holding only the built-in solvers.
     */
    public static AssignmentSolverRegistry builtIns() {
        return BUILT_INS;
    }

    /**
     * Resolves a solver; surrounding whitespace in the id is ignored.
     *
     * @throws AssociationException with {@link AssociationException#REASON_UNKNOWN_SOLVER} when no
     * solver is registered under {@code solverId}.
     */
    public AssignmentSolver solver(String solverId) {
        AssignmentSolver solver = solverId == null ? null : solversById.get(solverId.trim());
        if (solver == null) {
            throw new AssociationException(
                    AssociationException.REASON_UNKNOWN_SOLVER,
                    "unknown assignment solver id: " + solverId + ", known: " + solversById.keySet()
            );
        }
        return solver;
    }

    /**
     * Registered ids in registration order.
     */
    public Set<String> solverIds() {
        return solversById.keySet();
    }

    private static void register(Map<String, AssignmentSolver> byId, AssignmentSolver solver) {
        Objects.requireNonNull(solver, "solver");
        String id = solver.id();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("solver id must be non-blank: " + solver.getClass().getName());
        }
        byId.put(id.trim(), solver);
    }
}
