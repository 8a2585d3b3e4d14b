package com.flagship.order_ledger.fee;

import com.flagship.order_ledger.fee.dto.FeeEvaluationRequest;
import com.flagship.order_ledger.fee.dto.FeeEvaluationResponse;
import com.flagship.order_ledger.fee.dto.RuleValidationRequest;
import com.flagship.order_ledger.fee.dto.RuleValidationResponse;
import com.flagship.order_ledger.fee.dto.ShippingRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for COD fees, quantity pricing and shipping charges.
 * Stateless: every tariff arrives with the request.
 */
@RestController
@RequestMapping("/api/fees")
@RequiredArgsConstructor
@Slf4j
public class FeeController {

    private final FeeRuleParser ruleParser;
    private final FeeRuleEvaluator evaluator;
    private final ShippingChargeCalculator shippingCalculator;

    @PostMapping("/evaluate")
    public ResponseEntity<FeeEvaluationResponse> evaluate(@Valid @RequestBody FeeEvaluationRequest request) {
        FeeRuleConfig config = toConfig(request);
        return ResponseEntity.ok(new FeeEvaluationResponse(
            request.getValue(),
            evaluator.evaluateFeeRule(config, request.getValue()),
            config.getMode(),
            config.getDomain(),
            warnings(config.getRules())
        ));
    }

    @PostMapping("/cod")
    public ResponseEntity<CodFeeResult> codFee(@Valid @RequestBody FeeEvaluationRequest request) {
        return ResponseEntity.ok(evaluator.calculateCodFee(toConfig(request), request.getValue()));
    }

    @PostMapping("/rules/validate")
    public ResponseEntity<RuleValidationResponse> validateRules(@RequestBody RuleValidationRequest request) {
        FeeRuleSet rules = ruleParser.parse(request.getRules());
        List<String> warnings = warnings(rules);
        if (!warnings.isEmpty()) {
            log.info("Fee rules accepted with {} overlapping ranges", warnings.size());
        }
        return ResponseEntity.ok(new RuleValidationResponse(true, rules.getRules(), warnings));
    }

    @PostMapping("/shipping")
    public ResponseEntity<ShippingQuote> shipping(@Valid @RequestBody ShippingRequest request) {
        ShippingConfig config = ShippingConfig.builder()
            .cityCharges(request.getCityCharges() != null ? request.getCityCharges() : Map.of())
            .defaultCityCharge(request.getDefaultCityCharge())
            .quantityRules(ruleParser.parse(request.getQuantityRules()))
            .defaultQuantityCharge(request.getDefaultQuantityCharge())
            .build();

        List<ProductShipping> products = request.getProducts() == null ? List.of() : request.getProducts().stream()
            .map(line -> ProductShipping.builder()
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .useDefaultShipping(line.getUseDefaultShipping() == null || line.getUseDefaultShipping())
                .rules(ruleParser.parse(line.getShippingQuantityRules()))
                .defaultQuantityCharge(line.getShippingDefaultQuantityCharge())
                .build())
            .collect(Collectors.toList());

        return ResponseEntity.ok(shippingCalculator.calculate(config, request.getCity(), products));
    }

    private FeeRuleConfig toConfig(FeeEvaluationRequest request) {
        return FeeRuleConfig.builder()
            .mode(request.getMode())
            .domain(request.getDomain() != null ? request.getDomain() : FeeDomain.COD)
            .rules(ruleParser.parse(request.getRules()))
            .defaultFee(request.getDefaultFee())
            .percentage(request.getPercentage())
            .flatAmount(request.getFlatAmount())
            .build();
    }

    private static List<String> warnings(FeeRuleSet rules) {
        return rules.overlaps().stream()
            .map(FeeRuleSet.Overlap::describe)
            .collect(Collectors.toList());
    }
}
