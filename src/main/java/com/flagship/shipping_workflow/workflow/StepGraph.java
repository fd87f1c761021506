package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.order.PaymentMethod;
import com.flagship.shipping_workflow.quote.Quote;
import com.flagship.shipping_workflow.session.FieldPatch;
import com.flagship.shipping_workflow.session.SessionField;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.flagship.shipping_workflow.workflow.WorkflowStep.*;

/**
 * Static definition of the ordering workflow: nodes, forward and skip edges,
 * input contracts and the rollback table.
 *
 * Immutable after construction and safe to share between threads. Terminal
 * steps have no definition; they are never a resting point for a session.
 */
public final class StepGraph {

    private static final Set<String> CONFIRM_WORDS = Set.of("confirm", "yes", "ok");

    private final Map<WorkflowStep, StepDefinition> definitions;

    private StepGraph(Map<WorkflowStep, StepDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new EnumMap<>(definitions));
    }

    /**
     * The shipment-ordering graph.
     *
     * @param defaultDimension dimension written when the user skips a parcel size
     * @param placeholderPhones source of phone numbers for skipped phone steps
     */
    public static StepGraph standard(BigDecimal defaultDimension, Supplier<String> placeholderPhones) {
        String dim = defaultDimension.stripTrailingZeros().toPlainString();
        Map<WorkflowStep, StepDefinition> defs = new EnumMap<>(WorkflowStep.class);

        defs.put(START, new StepDefinition(START, input -> StepResult.accepted(FieldPatch.empty(), FROM_NAME),
                FROM_NAME, null, START, Set.of()));

        field(defs, FROM_NAME, SessionField.FROM_NAME, InputValidators::name, FROM_ADDRESS, START, null);
        field(defs, FROM_ADDRESS, SessionField.FROM_ADDRESS, InputValidators::address, FROM_ADDRESS2, FROM_NAME, null);
        field(defs, FROM_ADDRESS2, SessionField.FROM_ADDRESS2, InputValidators::address, FROM_CITY, FROM_ADDRESS,
                new SkipEdge(FROM_CITY, () -> FieldPatch.of(SessionField.FROM_ADDRESS2, null)));
        field(defs, FROM_CITY, SessionField.FROM_CITY, InputValidators::city, FROM_STATE, FROM_ADDRESS2, null);
        field(defs, FROM_STATE, SessionField.FROM_STATE, InputValidators::state, FROM_ZIP, FROM_CITY, null);
        field(defs, FROM_ZIP, SessionField.FROM_ZIP, InputValidators::zip, FROM_PHONE, FROM_STATE, null);
        field(defs, FROM_PHONE, SessionField.FROM_PHONE, InputValidators::phone, TO_NAME, FROM_ZIP,
                new SkipEdge(TO_NAME, () -> FieldPatch.of(SessionField.FROM_PHONE, placeholderPhones.get())));

        field(defs, TO_NAME, SessionField.TO_NAME, InputValidators::name, TO_ADDRESS, FROM_PHONE, null);
        field(defs, TO_ADDRESS, SessionField.TO_ADDRESS, InputValidators::address, TO_ADDRESS2, TO_NAME, null);
        field(defs, TO_ADDRESS2, SessionField.TO_ADDRESS2, InputValidators::address, TO_CITY, TO_ADDRESS,
                new SkipEdge(TO_CITY, () -> FieldPatch.of(SessionField.TO_ADDRESS2, null)));
        field(defs, TO_CITY, SessionField.TO_CITY, InputValidators::city, TO_STATE, TO_ADDRESS2, null);
        field(defs, TO_STATE, SessionField.TO_STATE, InputValidators::state, TO_ZIP, TO_CITY, null);
        field(defs, TO_ZIP, SessionField.TO_ZIP, InputValidators::zip, TO_PHONE, TO_STATE, null);
        field(defs, TO_PHONE, SessionField.TO_PHONE, InputValidators::phone, PARCEL_WEIGHT, TO_ZIP,
                new SkipEdge(PARCEL_WEIGHT, () -> FieldPatch.of(SessionField.TO_PHONE, placeholderPhones.get())));

        field(defs, PARCEL_WEIGHT, SessionField.WEIGHT, InputValidators::weight, PARCEL_LENGTH, TO_PHONE, null);
        field(defs, PARCEL_LENGTH, SessionField.LENGTH, InputValidators::dimension, PARCEL_WIDTH, PARCEL_WEIGHT,
                new SkipEdge(CONFIRM_DATA, () -> FieldPatch.of(SessionField.LENGTH, dim)
                        .with(SessionField.WIDTH, dim)
                        .with(SessionField.HEIGHT, dim)));
        field(defs, PARCEL_WIDTH, SessionField.WIDTH, InputValidators::dimension, PARCEL_HEIGHT, PARCEL_LENGTH,
                new SkipEdge(CONFIRM_DATA, () -> FieldPatch.of(SessionField.WIDTH, dim)
                        .with(SessionField.HEIGHT, dim)));
        field(defs, PARCEL_HEIGHT, SessionField.HEIGHT, InputValidators::dimension, CONFIRM_DATA, PARCEL_WIDTH,
                new SkipEdge(CONFIRM_DATA, () -> FieldPatch.of(SessionField.HEIGHT, dim)));

        defs.put(CONFIRM_DATA, new StepDefinition(CONFIRM_DATA, StepGraph::confirm,
                CARRIER_SELECTION, null, PARCEL_HEIGHT, Set.of()));
        defs.put(CARRIER_SELECTION, new StepDefinition(CARRIER_SELECTION, StepGraph::selectQuote,
                PAYMENT_METHOD, null, CONFIRM_DATA,
                EnumSet.of(SessionField.SELECTED_QUOTE_ID, SessionField.SELECTED_CARRIER,
                        SessionField.SELECTED_SERVICE, SessionField.SELECTED_AMOUNT)));
        defs.put(PAYMENT_METHOD, new StepDefinition(PAYMENT_METHOD, StepGraph::choosePaymentMethod,
                COMPLETED, null, CARRIER_SELECTION, EnumSet.of(SessionField.PAYMENT_METHOD)));

        return new StepGraph(defs);
    }

    public StepDefinition definition(WorkflowStep step) {
        StepDefinition definition = definitions.get(step);
        if (definition == null) {
            throw new IllegalArgumentException("No definition for terminal step " + step);
        }
        return definition;
    }

    /**
     * Runs the step's contract against the input.
     */
    public StepResult evaluate(WorkflowStep step, StepInput input) {
        return definition(step).getContract().evaluate(input);
    }

    /**
     * Takes the step's skip edge, if it has one.
     */
    public Optional<StepResult> skip(WorkflowStep step) {
        return definition(step).skip().map(SkipEdge::take);
    }

    /**
     * Static rollback target. START and terminal steps roll back to START.
     */
    public WorkflowStep predecessorOf(WorkflowStep step) {
        StepDefinition definition = definitions.get(step);
        return definition == null ? START : definition.getPredecessor();
    }

    public Set<WorkflowStep> forwardTargets(WorkflowStep step) {
        StepDefinition definition = definition(step);
        EnumSet<WorkflowStep> targets = EnumSet.of(definition.getForwardTarget());
        definition.skip().ifPresent(edge -> targets.add(edge.getTarget()));
        return targets;
    }

    /**
     * Fields present in every session that reaches {@code step} by forward
     * or skip edges from START.
     */
    public Set<SessionField> fieldsGuaranteedAfter(WorkflowStep step) {
        EnumSet<SessionField> fields = EnumSet.noneOf(SessionField.class);
        WorkflowStep current = START;
        while (current != step && definitions.containsKey(current)) {
            fields.addAll(definitions.get(current).getWrites());
            current = definitions.get(current).getForwardTarget();
        }
        return fields;
    }

    public boolean isDefined(WorkflowStep step) {
        return definitions.containsKey(step);
    }

    private static void field(Map<WorkflowStep, StepDefinition> defs,
                              WorkflowStep step,
                              SessionField field,
                              Function<String, ValidationResult> validator,
                              WorkflowStep next,
                              WorkflowStep predecessor,
                              SkipEdge skipEdge) {
        StepContract contract = input -> {
            ValidationResult result = validator.apply(input.getRaw());
            return result.isValid()
                    ? StepResult.accepted(FieldPatch.of(field, result.getValue()), next)
                    : StepResult.rejected(result.getError());
        };
        defs.put(step, new StepDefinition(step, contract, next, skipEdge, predecessor, EnumSet.of(field)));
    }

    private static StepResult confirm(StepInput input) {
        String answer = input.getRaw() == null ? "" : input.getRaw().strip().toLowerCase(Locale.ROOT);
        if (CONFIRM_WORDS.contains(answer)) {
            return StepResult.accepted(FieldPatch.empty(), CARRIER_SELECTION);
        }
        return StepResult.rejected("Reply 'confirm' to continue, go back to edit, or cancel");
    }

    /**
     * Accepts a quote id or its 1-based position in the offered list.
     */
    private static StepResult selectQuote(StepInput input) {
        List<Quote> quotes = input.getQuotes();
        if (quotes == null || quotes.isEmpty()) {
            return StepResult.rejected("No rates on offer, refresh the list");
        }
        String choice = input.getRaw() == null ? "" : input.getRaw().strip();

        Quote selected = quotes.stream()
                .filter(q -> q.getQuoteId().equals(choice))
                .findFirst()
                .orElseGet(() -> byIndex(quotes, choice));

        if (selected == null) {
            return StepResult.rejected("Choose a rate from the list by its number");
        }
        FieldPatch patch = FieldPatch.of(SessionField.SELECTED_QUOTE_ID, selected.getQuoteId())
                .with(SessionField.SELECTED_CARRIER, selected.getCarrier())
                .with(SessionField.SELECTED_SERVICE, selected.getService())
                .with(SessionField.SELECTED_AMOUNT, selected.getAmount().toPlainString());
        return StepResult.accepted(patch, PAYMENT_METHOD);
    }

    private static Quote byIndex(List<Quote> quotes, String choice) {
        try {
            int index = Integer.parseInt(choice);
            return index >= 1 && index <= quotes.size() ? quotes.get(index - 1) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static StepResult choosePaymentMethod(StepInput input) {
        return PaymentMethod.parse(input.getRaw())
                .map(method -> StepResult.accepted(FieldPatch.of(SessionField.PAYMENT_METHOD, method.name()), COMPLETED))
                .orElseGet(() -> StepResult.rejected("Reply 'balance' or 'invoice'"));
    }
}
