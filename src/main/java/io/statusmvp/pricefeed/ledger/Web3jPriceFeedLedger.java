package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.config.LedgerProperties;
import io.statusmvp.pricefeed.error.LedgerException;
import io.statusmvp.pricefeed.error.PublishException;
import io.statusmvp.pricefeed.model.LedgerRecord;
import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

/**
 * Price-feed contract on an EVM chain.
 *
 * <pre>
 *   getLatest(string symbol) view returns (uint256 roundId, uint256 price, uint256 timestampMs)
 *   update(string symbol, uint256 roundId, uint256 price, uint256 timestampMs,
 *          bytes32 attestationHash, bytes32 sourceSetId)
 * </pre>
 *
 * <p>Updates are simulated with {@code eth_call} first so a round conflict surfaces as a {@link
 * PublishException} without spending gas.
 */
public class Web3jPriceFeedLedger implements PriceLedger {
  private static final Logger log = LoggerFactory.getLogger(Web3jPriceFeedLedger.class);

  private final Web3j web3j;
  private final String contractAddress;
  private final String fromAddress;
  private final TransactionManager txManager;
  private final TransactionReceiptProcessor receipts;
  private final BigInteger gasLimit;
  private final boolean awaitReceipt;

  public Web3jPriceFeedLedger(Web3j web3j, LedgerProperties properties) {
    this(
        web3j,
        properties,
        Credentials.create(properties.getPrivateKey().trim()),
        new PollingTransactionReceiptProcessor(
            web3j, Math.max(100, properties.getReceiptPollMs()), Math.max(1, properties.getReceiptAttempts())));
  }

  Web3jPriceFeedLedger(
      Web3j web3j,
      LedgerProperties properties,
      Credentials credentials,
      TransactionReceiptProcessor receipts) {
    if (properties.getContractAddress() == null || properties.getContractAddress().isBlank()) {
      throw new IllegalArgumentException("app.ledger.contract-address is required in web3 mode");
    }
    this.web3j = web3j;
    this.contractAddress = properties.getContractAddress().trim();
    this.fromAddress = credentials.getAddress();
    this.txManager = new RawTransactionManager(web3j, credentials, properties.getChainId());
    this.receipts = receipts;
    this.gasLimit = BigInteger.valueOf(properties.getGasLimit());
    this.awaitReceipt = properties.isAwaitReceipt();
  }

  @Override
  public String mode() {
    return "web3";
  }

  @Override
  public LedgerRecord getLatest(String symbol) {
    Function fn =
        new Function(
            "getLatest",
            List.of(new Utf8String(symbol)),
            Arrays.asList(
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {},
                new TypeReference<Uint256>() {}));
    try {
      EthCall resp = call(FunctionEncoder.encode(fn));
      if (resp.hasError()) {
        throw new LedgerException(symbol, "getLatest failed: " + resp.getError().getMessage(), null);
      }
      String value = resp.getValue();
      if (value == null || value.isBlank() || "0x".equals(value)) return LedgerRecord.empty(symbol);

      @SuppressWarnings("rawtypes")
      List<Type> decoded = FunctionReturnDecoder.decode(value, fn.getOutputParameters());
      if (decoded.size() < 3) return LedgerRecord.empty(symbol);
      long round = ((Uint256) decoded.get(0)).getValue().longValueExact();
      long price = ((Uint256) decoded.get(1)).getValue().longValueExact();
      long ts = ((Uint256) decoded.get(2)).getValue().longValueExact();
      return new LedgerRecord(symbol, round, price, round > 0 ? Instant.ofEpochMilli(ts) : null);
    } catch (IOException e) {
      throw new LedgerException(symbol, "getLatest request failed for " + symbol, e);
    } catch (ArithmeticException e) {
      throw new LedgerException(symbol, "getLatest returned out-of-range values for " + symbol, e);
    }
  }

  @Override
  public String update(
      String symbol,
      long roundId,
      long price,
      Instant timestamp,
      byte[] attestationHash,
      byte[] sourceSetId) {
    if (price < 0) {
      throw new PublishException(
          symbol, roundId, "negative value " + price + " cannot be written as uint256 for " + symbol);
    }
    Function fn =
        new Function(
            "update",
            List.of(
                new Utf8String(symbol),
                new Uint256(BigInteger.valueOf(roundId)),
                new Uint256(BigInteger.valueOf(price)),
                new Uint256(BigInteger.valueOf(timestamp.toEpochMilli())),
                new Bytes32(attestationHash),
                new Bytes32(sourceSetId)),
            List.of());
    String data = FunctionEncoder.encode(fn);

    try {
      EthCall simulated = call(data);
      if (simulated.hasError() || simulated.isReverted()) {
        String reason =
            simulated.hasError() ? simulated.getError().getMessage() : simulated.getRevertReason();
        throw new PublishException(symbol, roundId, "update rejected for " + symbol + " round " + roundId + ": " + reason);
      }

      BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
      EthSendTransaction sent =
          txManager.sendTransaction(gasPrice, gasLimit, contractAddress, data, BigInteger.ZERO);
      if (sent.hasError()) {
        throw new PublishException(
            symbol, roundId, "update submit failed for " + symbol + ": " + sent.getError().getMessage());
      }
      String txHash = sent.getTransactionHash();
      if (awaitReceipt) {
        TransactionReceipt receipt = receipts.waitForTransactionReceipt(txHash);
        if (!receipt.isStatusOK()) {
          throw new PublishException(
              symbol, roundId, "update reverted on chain for " + symbol + " tx=" + txHash);
        }
      }
      log.debug("ledger update sent symbol={} round={} tx={}", symbol, roundId, txHash);
      return txHash;
    } catch (IOException | TransactionException e) {
      throw new PublishException(symbol, roundId, "update request failed for " + symbol, e);
    }
  }

  private EthCall call(String data) throws IOException {
    Transaction tx = Transaction.createEthCallTransaction(fromAddress, contractAddress, data);
    return web3j.ethCall(tx, DefaultBlockParameterName.LATEST).send();
  }
}
