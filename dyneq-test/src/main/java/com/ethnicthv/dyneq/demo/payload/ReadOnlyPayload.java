package com.ethnicthv.dyneq.demo.payload;

import com.ethnicthv.dyneq.core.marker.ThreadShared;

public interface ReadOnlyPayload extends Payload, ThreadShared {
}
