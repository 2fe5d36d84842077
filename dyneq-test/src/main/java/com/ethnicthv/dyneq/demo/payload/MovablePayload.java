package com.ethnicthv.dyneq.demo.payload;

import com.ethnicthv.dyneq.core.marker.ThreadMovable;

public interface MovablePayload extends Payload, ThreadMovable {
}
