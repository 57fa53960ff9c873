package com.yieldvault.ledger;

import java.math.BigInteger;

/** Supplies the asset value currently deployed into inputs. */
public interface InvestedValueSource {

    BigInteger invested();
}
