package ca.gc.cra.ferry.application.transfer;

import ca.gc.cra.ferry.domain.outcome.ProcessorResult;
import java.util.Objects;

/**
 * Summary of one upload run.
 *
 * @param totalItems items yielded by the download stage
 * @param result merged outcome ledger of every uploaded chunk
 * @param <ID> item identifier type
 * @since 0.1.0
 */
public record TransferReport<ID>(long totalItems, ProcessorResult<ID> result) {
  public TransferReport {
    Objects.requireNonNull(result, "result");
  }
}
