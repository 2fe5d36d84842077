@DynEqObject("<K> Keyed<K> where K extends Comparable<K>")
package com.ethnicthv.dyneq.demo.keyed;

import com.ethnicthv.dyneq.core.annotation.DynEqObject;
