package com.mintflow.service;

import com.mintflow.model.BudgetAlert;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BudgetAlertService {
  private static final Logger log = LoggerFactory.getLogger(BudgetAlertService.class);

  private final BudgetEvaluator evaluator;
  private final AlertDispatcher dispatcher;

  public BudgetAlertService(BudgetEvaluator evaluator, AlertDispatcher dispatcher) {
    this.evaluator = evaluator;
    this.dispatcher = dispatcher;
  }

  public List<BudgetAlert> run(UUID userId) {
    List<BudgetAlert> fired = evaluator.evaluate(userId);
    int sent = 0;
    for (BudgetAlert alert : fired) {
      if (dispatcher.dispatch(alert)) {
        sent++;
      }
    }
    if (!fired.isEmpty()) {
      log.info("Budget pass for user {}: {} alerts fired, {} sent", userId, fired.size(), sent);
    }
    return fired;
  }
}
