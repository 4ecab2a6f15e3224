package FSA.Model;

/**
 * How much of the Cartesian product a product construction materializes.
 */
public enum ProductMode {
    /**
     * Every pair (q1, q2). Quadratic in the operand sizes even when most pairs are unreachable.
     */
    EAGER,
    /**
     * Only pairs reachable from the start pair, discovered by a worklist. Accepts the same language as
     * {@link #EAGER} with at most as many states.
     */
    REACHABLE
}
