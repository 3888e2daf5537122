package com.codeheadsystems.keymaster.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keymaster.common.KeymasterBuffer;
import com.codeheadsystems.keymaster.common.KeymasterException;
import com.codeheadsystems.keymaster.engine.HmacContext;
import com.codeheadsystems.keymaster.engine.HmacEngine;
import com.codeheadsystems.keymaster.model.KeymasterDigest;
import com.codeheadsystems.keymaster.model.KeymasterError;
import com.codeheadsystems.keymaster.model.KeymasterPurpose;
import com.codeheadsystems.keymaster.model.UpdateResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Failures inside the keyed-hash engine must come back as {@link KeymasterError#UNKNOWN_ERROR} and must
 * never leak the context.
 */
@ExtendWith(MockitoExtension.class)
class HmacOperationEngineFailureTest {

  private static final byte[] KEY = {1, 2, 3, 4};
  private static final byte[] DATA = {5, 6, 7};

  @Mock private HmacEngine engine;
  @Mock private HmacContext context;

  @BeforeEach
  void setUp() {
    when(engine.supports(KeymasterDigest.SHA_2_256)).thenReturn(true);
    when(engine.outputSize(KeymasterDigest.SHA_2_256)).thenReturn(32);
  }

  @Test
  void update_engineFailure_unknownError() {
    when(engine.init(eq(KeymasterDigest.SHA_2_256), any())).thenReturn(context);
    doThrow(new KeymasterException(KeymasterError.UNKNOWN_ERROR, "boom"))
        .when(context).update(any(), anyInt(), anyInt());

    try (HmacOperation operation = newOperation(KeymasterPurpose.SIGN)) {
      assertThat(operation.begin()).isEqualTo(KeymasterError.OK);
      assertThat(operation.update(new KeymasterBuffer(DATA), new KeymasterBuffer()))
          .isEqualTo(UpdateResult.failure(KeymasterError.UNKNOWN_ERROR));
    }
    verify(context).close();
  }

  @Test
  void update_passesReadableSpanInOneCall() {
    when(engine.init(eq(KeymasterDigest.SHA_2_256), any())).thenReturn(context);
    KeymasterBuffer input = new KeymasterBuffer(new byte[]{0, 0, 5, 6, 7});
    input.advanceRead(2);

    try (HmacOperation operation = newOperation(KeymasterPurpose.SIGN)) {
      assertThat(operation.update(input, new KeymasterBuffer())).isEqualTo(new UpdateResult(KeymasterError.OK, 3));
    }
    verify(context, times(1)).update(input.array(), 2, 3);
  }

  @Test
  void finish_engineFailure_unknownErrorAndContextReleased() {
    when(engine.init(eq(KeymasterDigest.SHA_2_256), any())).thenReturn(context);
    when(context.doFinal()).thenThrow(new KeymasterException(KeymasterError.UNKNOWN_ERROR, "boom"));

    HmacOperation operation = newOperation(KeymasterPurpose.VERIFY);
    KeymasterBuffer output = new KeymasterBuffer();
    assertThat(operation.finish(new KeymasterBuffer(new byte[32]), output)).isEqualTo(KeymasterError.UNKNOWN_ERROR);
    assertThat(output.availableRead()).isZero();
    verify(context).close();

    operation.close();
    verify(context, times(1)).close();
  }

  @Test
  void init_engineFailure_surfacesFromBegin() {
    when(engine.init(eq(KeymasterDigest.SHA_2_256), any()))
        .thenThrow(new KeymasterException(KeymasterError.UNKNOWN_ERROR, "no provider"));

    try (HmacOperation operation = newOperation(KeymasterPurpose.SIGN)) {
      assertThat(operation.begin()).isEqualTo(KeymasterError.UNKNOWN_ERROR);
      assertThat(operation.finish(new KeymasterBuffer(), new KeymasterBuffer())).isEqualTo(KeymasterError.UNKNOWN_ERROR);
    }
  }

  @Test
  void unsupportedMacLength_neverInitializesEngine() {
    try (HmacOperation operation = new HmacOperation(KeymasterPurpose.SIGN, KEY, KeymasterDigest.SHA_2_256, 33,
        engine)) {
      assertThat(operation.begin()).isEqualTo(KeymasterError.UNSUPPORTED_MAC_LENGTH);
    }
    verify(engine, never()).init(any(), any());
  }

  @Test
  void close_releasesContextExactlyOnce() {
    when(engine.init(eq(KeymasterDigest.SHA_2_256), any())).thenReturn(context);

    HmacOperation operation = newOperation(KeymasterPurpose.SIGN);
    operation.abort();
    operation.close();
    operation.close();
    verify(context, times(1)).close();
  }

  private HmacOperation newOperation(KeymasterPurpose purpose) {
    return new HmacOperation(purpose, KEY, KeymasterDigest.SHA_2_256, 32, engine);
  }
}
